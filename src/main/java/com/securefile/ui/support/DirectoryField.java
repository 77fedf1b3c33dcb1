package com.securefile.ui.support;

import com.securefile.config.ConfigService;

import javax.swing.JButton;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JTextField;
import java.awt.GridBagConstraints;
import java.awt.Insets;
import java.io.File;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Label, editable path field and "Browse" button laid out as one row of a GridBag form.
 * The last picked folder is remembered under {@code preferenceKey}.
 */
public final class DirectoryField {
    private final JTextField field = new JTextField(50);
    private final JButton browseBtn = new JButton("Browse");
    private final String dialogTitle;
    private final String preferenceKey;
    private final ConfigService config;
    private Consumer<Path> onPicked = p -> { };

    public DirectoryField(String dialogTitle, String preferenceKey, ConfigService config) {
        this.dialogTitle = dialogTitle;
        this.preferenceKey = preferenceKey;
        this.config = config;
        config.getLastDirectory(preferenceKey).ifPresent(p -> field.setText(p.toString()));
        browseBtn.addActionListener(e -> browse());
    }

    public void addTo(JPanel form, int row, String label) {
        GridBagConstraints c = new GridBagConstraints();
        c.gridx = 0;
        c.gridy = row;
        c.insets = new Insets(row == 0 ? 0 : 8, 0, 0, 6);
        c.anchor = GridBagConstraints.WEST;
        form.add(new JLabel(label), c);
        c.gridx = 1;
        c.weightx = 1;
        c.fill = GridBagConstraints.HORIZONTAL;
        form.add(field, c);
        c.gridx = 2;
        c.weightx = 0;
        c.fill = GridBagConstraints.NONE;
        form.add(browseBtn, c);
    }

    public void onPicked(Consumer<Path> listener) {
        this.onPicked = listener;
    }

    public String text() {
        return field.getText().strip();
    }

    private void browse() {
        JFileChooser chooser = new JFileChooser(text().isEmpty() ? null : new File(text()));
        chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        chooser.setDialogTitle(dialogTitle);
        if (chooser.showOpenDialog(field) != JFileChooser.APPROVE_OPTION) {
            // cancelling keeps whatever was typed in the field
            return;
        }
        Path picked = chooser.getSelectedFile().toPath();
        field.setText(picked.toString());
        config.rememberDirectory(preferenceKey, picked);
        onPicked.accept(picked);
    }
}
