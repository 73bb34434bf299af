package com.packlabels.ui;

import javax.swing.JFrame;
import java.awt.Dimension;

/**
 * Standalone window hosting the {@link LabelSheetPanel}.
 */
public class LabelSheetFrame extends JFrame {

    public LabelSheetFrame() {
        super("Carry-Out Label Sheet");
        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);

        LabelSheetPanel panel = new LabelSheetPanel();
        panel.setPreferredSize(new Dimension(640, 220));
        setContentPane(panel);
    }
}
