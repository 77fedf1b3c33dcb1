package com.securefile.ui.integrity;

import com.securefile.config.ConfigService;
import com.securefile.core.layout.OrganizedLayout;
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Runs the verify script against an organized folder and shows its checksum report.
 */
public class IntegrityPanel extends JPanel {
    private static final Logger LOGGER = AppLogger.get();

    private final ScriptActions actions;
    private final DirectoryField organizedField;
    private final JTextArea outputArea = new JTextArea();
    private final TextAreaSink sink = new TextAreaSink(outputArea);
    private final JLabel statusLabel = new JLabel("Idle");
    private final JProgressBar progressBar = new JProgressBar();
    private final JButton verifyBtn = new JButton("Run Integrity Check");

    public IntegrityPanel(ScriptActions actions, ConfigService config) {
        this.actions = actions;
        this.organizedField = new DirectoryField("Select Organized Folder to Verify", "integrity.dir", config);

        setLayout(new BorderLayout(8, 8));
        setBorder(new EmptyBorder(10, 10, 10, 10));

        JPanel form = new JPanel(new GridBagLayout());
        organizedField.addTo(form, 0, "Organized Directory:");

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        JButton checksumBtn = new JButton("Open Checksum Log");
        buttons.add(verifyBtn);
        buttons.add(checksumBtn);

        JPanel status = new JPanel(new BorderLayout(6, 0));
        status.add(new JLabel("Integrity Status:"), BorderLayout.WEST);
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

        verifyBtn.addActionListener(e -> onVerify());
        checksumBtn.addActionListener(e -> onOpenChecksumLog());
    }

    private void onVerify() {
        RunHandle run;
        try {
            run = actions.verify(organizedField.text(), sink);
        } catch (ValidationException ex) {
            boolean missing = ex.getReason() == ValidationException.Reason.MISSING;
            statusLabel.setText(ex.getMessage());
            JOptionPane.showMessageDialog(this, ex.getMessage(),
                missing ? "Missing path" : "Invalid directory",
                missing ? JOptionPane.WARNING_MESSAGE : JOptionPane.ERROR_MESSAGE);
            return;
        } catch (IllegalStateException busy) {
            JOptionPane.showMessageDialog(this, "An integrity check is already running.", "Busy", JOptionPane.WARNING_MESSAGE);
            return;
        }
        sink.clear();
        verifyBtn.setEnabled(false);
        statusLabel.setText("Running integrity check...");
        progressBar.setIndeterminate(true);
        run.completion().thenAccept(this::onComplete);
    }

    private void onComplete(int exitCode) {
        progressBar.setIndeterminate(false);
        verifyBtn.setEnabled(true);
        if (exitCode == 0) {
            statusLabel.setText("Integrity OK");
            JOptionPane.showMessageDialog(this, "All files match their checksums.", "Integrity", JOptionPane.INFORMATION_MESSAGE);
        } else {
            statusLabel.setText("Integrity FAILED (code " + exitCode + ")");
            JOptionPane.showMessageDialog(this, "Some files failed verification (code " + exitCode + "). Check logs.",
                "Integrity", JOptionPane.WARNING_MESSAGE);
        }
    }

    private void onOpenChecksumLog() {
        String dir = organizedField.text();
        if (dir.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Select organized directory first.", "Missing path", JOptionPane.WARNING_MESSAGE);
            return;
        }
        Path checksumLog = OrganizedLayout.checksumLog(Path.of(dir));
        if (!Files.isRegularFile(checksumLog)) {
            statusLabel.setText("Checksum log not found");
            JOptionPane.showMessageDialog(this, "Checksum log not found: " + checksumLog, "Not found", JOptionPane.ERROR_MESSAGE);
            return;
        }
        try {
            DesktopLauncher.open(checksumLog);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warning("Could not open " + checksumLog + ": " + ex.getMessage());
            JOptionPane.showMessageDialog(this, "Could not open " + checksumLog + "\n" + ex.getMessage(),
                "Open failed", JOptionPane.ERROR_MESSAGE);
        }
    }
}
