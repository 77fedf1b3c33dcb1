package com.securefile.ui.main;

import com.securefile.config.ConfigService;
import com.securefile.config.RunnerSettings;
import com.securefile.core.backup.BackupRestorer;
import com.securefile.core.loop.TickScheduler;
import com.securefile.core.script.ScriptActions;
import com.securefile.ui.backups.BackupsPanel;
import com.securefile.ui.integrity.IntegrityPanel;
import com.securefile.ui.logs.LiveLogsPanel;
import com.securefile.ui.organizer.OrganizerPanel;

import javax.swing.*;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;

/**
 * Main window: one tab per workflow (organize, verify, restore backups, follow logs).
 */
public class MainUIView {

    private final JFrame frame;
    private final LiveLogsPanel logsPanel;

    MainUIView(RunnerSettings settings, ScriptActions actions, TickScheduler scheduler, ConfigService config) {
        frame = new JFrame("Secure File Organizer");
        frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        frame.setSize(900, 680);
        frame.setMinimumSize(new Dimension(800, 600));

        logsPanel = new LiveLogsPanel(settings, scheduler, config);

        JTabbedPane tabbedPane = new JTabbedPane();
        tabbedPane.addTab("Organizer", new OrganizerPanel(actions, config));
        tabbedPane.addTab("Integrity", new IntegrityPanel(actions, config));
        tabbedPane.addTab("Backups", new BackupsPanel(new BackupRestorer(), config));
        tabbedPane.addTab("Logs", logsPanel);
        frame.add(tabbedPane, BorderLayout.CENTER);

        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosing(WindowEvent e) {
                logsPanel.shutdown();
            }
        });
        frame.setLocationRelativeTo(null);
    }

    void show() {
        frame.setVisible(true);
    }
}
