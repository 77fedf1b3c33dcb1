package com.securefile.ui.logs;

import com.securefile.config.ConfigService;
import com.securefile.config.RunnerSettings;
import com.securefile.core.layout.OrganizedLayout;
import com.securefile.core.loop.TickScheduler;
import com.securefile.core.tail.LogTailer;
import com.securefile.ui.support.DirectoryField;
import com.securefile.ui.support.TextAreaSink;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;
import java.nio.file.Path;
import java.util.List;

/**
 * Live view of the organizer and integrity-check logs of an organized folder.
 */
public class LiveLogsPanel extends JPanel {
    private final DirectoryField organizedField;
    private final JTextArea logArea = new JTextArea();
    private final TextAreaSink sink = new TextAreaSink(logArea);
    private final LogTailer tailer;
    private final JLabel statusLabel = new JLabel("Not tailing");

    public LiveLogsPanel(RunnerSettings settings, TickScheduler scheduler, ConfigService config) {
        this.organizedField = new DirectoryField("Select Organized Folder (for logs)", "logs.dir", config);
        this.tailer = new LogTailer(sink, scheduler, settings.tailIntervalMs());

        setLayout(new BorderLayout(8, 8));
        setBorder(new EmptyBorder(10, 10, 10, 10));

        JPanel form = new JPanel(new GridBagLayout());
        organizedField.addTo(form, 0, "Organized Directory (for logs):");

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        JButton startBtn = new JButton("Start Live Logs");
        JButton stopBtn = new JButton("Stop Live Logs");
        JButton clearBtn = new JButton("Clear Log View");
        buttons.add(startBtn);
        buttons.add(stopBtn);
        buttons.add(clearBtn);
        buttons.add(statusLabel);

        JPanel north = new JPanel(new BorderLayout());
        north.add(form, BorderLayout.NORTH);
        north.add(buttons, BorderLayout.SOUTH);
        add(north, BorderLayout.NORTH);

        logArea.setEditable(false);
        logArea.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));
        add(new JScrollPane(logArea), BorderLayout.CENTER);

        startBtn.addActionListener(e -> onStart());
        stopBtn.addActionListener(e -> {
            tailer.stop();
            statusLabel.setText("Not tailing");
        });
        clearBtn.addActionListener(e -> sink.clear());
    }

    public void shutdown() {
        tailer.stop();
    }

    private void onStart() {
        String dir = organizedField.text();
        if (dir.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Select organized directory to read logs from.",
                "Select directory", JOptionPane.WARNING_MESSAGE);
            return;
        }
        List<Path> logs = OrganizedLayout.existingLogs(Path.of(dir));
        if (logs.isEmpty()) {
            statusLabel.setText("No log files found");
            JOptionPane.showMessageDialog(this, "No log files found in the selected directory.",
                "No logs", JOptionPane.WARNING_MESSAGE);
            return;
        }
        sink.clear();
        tailer.start(logs);
        statusLabel.setText("Tailing " + logs.size() + " file(s)");
    }
}
