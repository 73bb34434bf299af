package com.packlabels.ui;

import javax.swing.SwingUtilities;

/**
 * Entry point for the label sheet window.
 */
public final class LabelSheetApp {
    private LabelSheetApp() {
    }

    public static void main(String[] args) {
        SwingUtilities.invokeLater(() -> {
            LabelSheetFrame frame = new LabelSheetFrame();
            frame.pack();
            frame.setLocationRelativeTo(null);
            frame.setVisible(true);
        });
    }
}
