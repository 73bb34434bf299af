package com.packlabels.ui;

import com.packlabels.cli.EmptyInputException;
import com.packlabels.cli.LabelSheetJob;
import com.packlabels.cli.LabelSheetResult;
import com.packlabels.config.ConfigService;
import com.packlabels.core.label.LabelLimitException;
import com.packlabels.core.order.OrderSchemaException;
import com.packlabels.core.sheet.OrderSheetReaders;
import com.packlabels.logging.AppLogger;

import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.SwingWorker;
import javax.swing.border.EmptyBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.FlowLayout;
import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pick an order sheet, pick where the PDF goes, generate.
 */
public class LabelSheetPanel extends JPanel {
    private static final Logger LOGGER = AppLogger.get();
    private static final Color ERROR_COLOR = new Color(0xB0, 0x1E, 0x1E);

    private final ConfigService config = ConfigService.getInstance();

    private final JLabel fileLabel = new JLabel("No order sheet selected");
    private final JLabel statusLabel = new JLabel("Choose an Excel or CSV order sheet to begin.");
    private final JButton chooseButton = new JButton("Choose Order Sheet…");
    private final JButton generateButton = new JButton("Generate Labels…");
    private final JCheckBox manifestToggle = new JCheckBox("Write manifest");

    private Path selectedInput;

    public LabelSheetPanel() {
        setLayout(new BorderLayout(8, 8));
        setBorder(new EmptyBorder(12, 12, 12, 12));

        JPanel fileRow = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 8));
        fileRow.add(chooseButton);
        fileRow.add(fileLabel);
        add(fileRow, BorderLayout.NORTH);

        JPanel actionRow = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 8));
        manifestToggle.setSelected(config.isManifestEnabled());
        manifestToggle.setToolTipText("Also save labels-manifest.json next to the PDF.");
        actionRow.add(generateButton);
        actionRow.add(manifestToggle);
        add(actionRow, BorderLayout.CENTER);

        add(statusLabel, BorderLayout.SOUTH);
        generateButton.setEnabled(false);

        chooseButton.addActionListener(e -> chooseInput());
        generateButton.addActionListener(e -> chooseOutputAndGenerate());
        manifestToggle.addActionListener(e -> config.setManifestEnabled(manifestToggle.isSelected()));
    }

    private void chooseInput() {
        JFileChooser chooser = new JFileChooser();
        config.getLastInputDirectory().ifPresent(dir -> chooser.setCurrentDirectory(dir.toFile()));
        chooser.setFileFilter(new FileNameExtensionFilter("Order sheets",
            OrderSheetReaders.SUPPORTED_EXTENSIONS.toArray(new String[0])));
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File file = chooser.getSelectedFile();
        Path path = file.toPath();
        if (!OrderSheetReaders.isSupported(path)) {
            showError("File type not supported. Choose one of: " + String.join(", ", OrderSheetReaders.SUPPORTED_EXTENSIONS));
            return;
        }
        selectedInput = path;
        if (path.getParent() != null) {
            config.setLastInputDirectory(path.getParent());
        }
        fileLabel.setText(path.getFileName().toString());
        generateButton.setEnabled(true);
        showInfo("Ready to generate labels.");
    }

    private void chooseOutputAndGenerate() {
        if (selectedInput == null) {
            return;
        }
        JFileChooser chooser = new JFileChooser(config.getOutputDirectory().toFile());
        chooser.setSelectedFile(config.getOutputDirectory().resolve(config.getOutputFileName()).toFile());
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path output = chooser.getSelectedFile().toPath();
        if (output.getParent() != null) {
            config.setOutputDirectory(output.getParent());
        }
        generate(selectedInput, output, manifestToggle.isSelected());
    }

    private void generate(Path input, Path output, boolean manifest) {
        setBusy(true);
        showInfo("Generating " + output.getFileName() + "…");
        LabelSheetJob job = LabelSheetJob.fromConfig(config);
        new SwingWorker<LabelSheetResult, Void>() {
            @Override
            protected LabelSheetResult doInBackground() throws Exception {
                return job.run(input, output, manifest);
            }

            @Override
            protected void done() {
                setBusy(false);
                try {
                    showInfo("Saved " + get().describe());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    showError("Generation interrupted.");
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    if (cause instanceof EmptyInputException
                        || cause instanceof OrderSchemaException
                        || cause instanceof LabelLimitException) {
                        showError(cause.getMessage());
                    } else {
                        LOGGER.log(Level.WARNING, "Label sheet generation failed", cause);
                        showError("Failed to generate PDF: " + cause.getMessage());
                    }
                }
            }
        }.execute();
    }

    private void setBusy(boolean busy) {
        chooseButton.setEnabled(!busy);
        generateButton.setEnabled(!busy && selectedInput != null);
    }

    private void showInfo(String message) {
        statusLabel.setForeground(getForeground());
        statusLabel.setText(message);
    }

    private void showError(String message) {
        statusLabel.setForeground(ERROR_COLOR);
        statusLabel.setText(message);
    }
}
