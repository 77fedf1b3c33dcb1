package com.securefile.ui.backups;

import com.securefile.config.ConfigService;
import com.securefile.core.backup.BackupEntry;
import com.securefile.core.backup.BackupRestorer;
import com.securefile.core.backup.RestoreException;
import com.securefile.core.backup.RestoreSummary;
import com.securefile.logging.AppLogger;
import com.securefile.ui.support.DirectoryField;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists the zip backups of an organized folder and restores the selected one.
 */
public class BackupsPanel extends JPanel {
    private static final Logger LOGGER = AppLogger.get();

    private final BackupRestorer restorer;
    private final DirectoryField organizedField;
    private final DefaultListModel<BackupEntry> backupsModel = new DefaultListModel<>();
    private final JList<BackupEntry> backupsList = new JList<>(backupsModel);
    private final JLabel statusLabel = new JLabel(" ");
    private final JButton restoreBtn = new JButton("Restore Selected Backup");

    public BackupsPanel(BackupRestorer restorer, ConfigService config) {
        this.restorer = restorer;
        this.organizedField = new DirectoryField("Select Organized Folder (contains backups/)", "backups.dir", config);
        organizedField.onPicked(p -> refresh());

        setLayout(new BorderLayout(8, 8));
        setBorder(new EmptyBorder(10, 10, 10, 10));

        JPanel form = new JPanel(new GridBagLayout());
        organizedField.addTo(form, 0, "Organized Directory (for backups):");

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        JButton refreshBtn = new JButton("Refresh Backups");
        buttons.add(refreshBtn);
        buttons.add(restoreBtn);

        JPanel north = new JPanel(new BorderLayout());
        north.add(form, BorderLayout.NORTH);
        north.add(buttons, BorderLayout.SOUTH);
        add(north, BorderLayout.NORTH);

        backupsList.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        add(new JScrollPane(backupsList), BorderLayout.CENTER);
        add(statusLabel, BorderLayout.SOUTH);

        refreshBtn.addActionListener(e -> refresh());
        restoreBtn.addActionListener(e -> onRestore());
    }

    private void refresh() {
        backupsModel.clear();
        String dir = organizedField.text();
        if (dir.isEmpty()) {
            return;
        }
        try {
            List<BackupEntry> backups = restorer.listBackups(Path.of(dir));
            backups.forEach(backupsModel::addElement);
            statusLabel.setText(backups.size() + " backup(s) found");
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not list backups in " + dir, ex);
            statusLabel.setText("Could not list backups");
            JOptionPane.showMessageDialog(this, "Could not list backups: " + ex.getMessage(), "Backups", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void onRestore() {
        BackupEntry selected = backupsList.getSelectedValue();
        if (selected == null) {
            JOptionPane.showMessageDialog(this, "Choose a backup to restore.", "Select backup", JOptionPane.WARNING_MESSAGE);
            return;
        }
        Path organizedDir = Path.of(organizedField.text());

        JFileChooser chooser = new JFileChooser();
        chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        chooser.setDialogTitle("Select folder to restore backup into");
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path destination = chooser.getSelectedFile().toPath();

        int answer = JOptionPane.showConfirmDialog(this,
            "Restore " + selected.fileName() + " into " + destination + "? This may overwrite files.",
            "Confirm restore", JOptionPane.YES_NO_OPTION);
        if (answer != JOptionPane.YES_OPTION) {
            return;
        }

        restoreBtn.setEnabled(false);
        statusLabel.setText("Restoring " + selected.fileName() + "...");
        new SwingWorker<RestoreSummary, Void>() {
            @Override
            protected RestoreSummary doInBackground() throws RestoreException {
                return restorer.restore(organizedDir, selected.fileName(), destination);
            }

            @Override
            protected void done() {
                restoreBtn.setEnabled(true);
                try {
                    RestoreSummary summary = get();
                    String message = "Backup restored into " + destination
                        + " (" + summary.filesExtracted() + " file(s))";
                    if (!summary.skippedEntries().isEmpty()) {
                        message += "\nSkipped: " + String.join(", ", summary.skippedEntries());
                    }
                    statusLabel.setText("Restored " + selected.fileName());
                    JOptionPane.showMessageDialog(BackupsPanel.this, message, "Restored", JOptionPane.INFORMATION_MESSAGE);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    statusLabel.setText("Restore failed");
                    boolean notFound = cause instanceof RestoreException restore && restore.isArchiveMissing();
                    JOptionPane.showMessageDialog(BackupsPanel.this,
                        cause.getMessage(),
                        notFound ? "Not found" : "Restore failed", JOptionPane.ERROR_MESSAGE);
                }
            }
        }.execute();
    }
}
