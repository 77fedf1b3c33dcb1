package com.securefile.ui.organizer;

import com.securefile.config.ConfigService;
import com.securefile.core.process.RunHandle;
import com.securefile.core.script.ScriptActions;
import com.securefile.core.script.ValidationException;
import com.securefile.logging.AppLogger;
import com.securefile.ui.support.DesktopLauncher;
import com.securefile.ui.support.DirectoryField;
import com.securefile.ui.support.TextAreaSink;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Runs the organize script on a source folder and streams its output.
 */
public class OrganizerPanel extends JPanel {
    private static final Logger LOGGER = AppLogger.get();

    private final ScriptActions actions;
    private final DirectoryField sourceField;
    private final DirectoryField outputField;
    private final JTextArea outputArea = new JTextArea();
    private final TextAreaSink sink = new TextAreaSink(outputArea);
    private final JLabel statusLabel = new JLabel("Idle");
    private final JProgressBar progressBar = new JProgressBar();
    private final JButton runBtn = new JButton("Run Organizer");
    private final JButton cancelBtn = new JButton("Cancel");
    private RunHandle currentRun;

    public OrganizerPanel(ScriptActions actions, ConfigService config) {
        this.actions = actions;
        this.sourceField = new DirectoryField("Select Source Folder", "organizer.source", config);
        this.outputField = new DirectoryField("Select Output Folder (existing) or Cancel to type new",
            "organizer.output", config);

        setLayout(new BorderLayout(8, 8));
        setBorder(new EmptyBorder(10, 10, 10, 10));

        JPanel form = new JPanel(new GridBagLayout());
        sourceField.addTo(form, 0, "Source Folder:");
        outputField.addTo(form, 1, "Organized Output Folder:");

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        JButton openOutputBtn = new JButton("Open Output Folder");
        JButton clearBtn = new JButton("Clear Output");
        cancelBtn.setEnabled(false);
        buttons.add(runBtn);
        buttons.add(openOutputBtn);
        buttons.add(clearBtn);
        buttons.add(cancelBtn);

        JPanel status = new JPanel(new BorderLayout(6, 0));
        status.add(new JLabel("Status:"), BorderLayout.WEST);
        status.add(statusLabel, BorderLayout.CENTER);
        status.add(progressBar, BorderLayout.SOUTH);

        JPanel north = new JPanel();
        north.setLayout(new BoxLayout(north, BoxLayout.Y_AXIS));
        north.add(form);
        north.add(buttons);
        north.add(status);
        add(north, BorderLayout.NORTH);

        outputArea.setEditable(false);
        outputArea.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));
        add(new JScrollPane(outputArea), BorderLayout.CENTER);

        runBtn.addActionListener(e -> onRun());
        openOutputBtn.addActionListener(e -> onOpenOutput());
        clearBtn.addActionListener(e -> sink.clear());
        cancelBtn.addActionListener(e -> onCancel());
    }

    private void onRun() {
        RunHandle run;
        try {
            run = actions.organize(sourceField.text(), outputField.text(), sink);
        } catch (ValidationException ex) {
            boolean missing = ex.getReason() == ValidationException.Reason.MISSING;
            statusLabel.setText(ex.getMessage());
            JOptionPane.showMessageDialog(this, ex.getMessage(),
                missing ? "Missing paths" : "Invalid source",
                missing ? JOptionPane.WARNING_MESSAGE : JOptionPane.ERROR_MESSAGE);
            return;
        } catch (IllegalStateException busy) {
            JOptionPane.showMessageDialog(this, "The organizer is still running.", "Busy", JOptionPane.WARNING_MESSAGE);
            return;
        }
        // the first drain tick is still pending, so nothing of the new run is lost
        sink.clear();
        currentRun = run;
        runBtn.setEnabled(false);
        cancelBtn.setEnabled(true);
        statusLabel.setText("Running organizer...");
        progressBar.setIndeterminate(true);
        // completes on the EDT, from the drain loop
        run.completion().thenAccept(code -> onComplete(run, code));
    }

    private void onComplete(RunHandle run, int exitCode) {
        currentRun = null;
        progressBar.setIndeterminate(false);
        runBtn.setEnabled(true);
        cancelBtn.setEnabled(false);
        if (run.wasCancelled()) {
            statusLabel.setText("Organizer cancelled (code " + exitCode + ")");
        } else if (exitCode == 0) {
            statusLabel.setText("Organizer completed successfully");
            JOptionPane.showMessageDialog(this, "Organizer finished successfully.", "Done", JOptionPane.INFORMATION_MESSAGE);
        } else {
            statusLabel.setText("Organizer finished with errors");
            JOptionPane.showMessageDialog(this, "Organizer returned code " + exitCode + ". Check logs.",
                "Completed with errors", JOptionPane.WARNING_MESSAGE);
        }
    }

    private void onCancel() {
        if (currentRun != null && currentRun.cancel()) {
            statusLabel.setText("Cancelling organizer...");
        }
    }

    private void onOpenOutput() {
        String output = outputField.text();
        if (output.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Please select an output folder first.", "No Output", JOptionPane.WARNING_MESSAGE);
            return;
        }
        try {
            DesktopLauncher.open(Path.of(output));
        } catch (IOException | RuntimeException ex) {
            LOGGER.warning("Could not open " + output + ": " + ex.getMessage());
            statusLabel.setText("Could not open output folder");
            JOptionPane.showMessageDialog(this, "Could not open " + output + "\n" + ex.getMessage(),
                "Open failed", JOptionPane.ERROR_MESSAGE);
        }
    }
}
