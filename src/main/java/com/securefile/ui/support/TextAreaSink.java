package com.securefile.ui.support;

import com.securefile.core.loop.OutputSink;

import javax.swing.JTextArea;

/**
 * Appends to a text area and keeps the caret, and so the viewport, on the last line.
 */
public final class TextAreaSink implements OutputSink {
    private final JTextArea area;

    public TextAreaSink(JTextArea area) {
        this.area = area;
    }

    @Override
    public void append(String text) {
        area.append(text);
        area.setCaretPosition(area.getDocument().getLength());
    }

    @Override
    public void clear() {
        area.setText("");
    }
}
