/*
 * Photo-Restore - Desktop front-end for old photo restoration
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.photo.restore.ui.gui;

import java.awt.*;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.swing.*;
import javax.swing.border.BevelBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import net.boyechko.photo.restore.config.RestorationSettings;
import net.boyechko.photo.restore.core.AsyncTaskRunner;
import net.boyechko.photo.restore.core.JobLauncher;
import net.boyechko.photo.restore.core.JobRequest;
import net.boyechko.photo.restore.core.JobResult;
import net.boyechko.photo.restore.core.RestorationService;
import net.boyechko.photo.restore.core.WorkerCommand;
import net.boyechko.photo.restore.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PhotoRestoreGUI extends JFrame {
    private static final Logger logger = LoggerFactory.getLogger(PhotoRestoreGUI.class);

    static final String APP_TITLE = "Bringing Old Photos Back to Life";
    static final String STATUS_READY = "Ready";
    static final String STATUS_RUNNING = "Running...";
    static final String[] IMAGE_EXTENSIONS = {"jpg", "jpeg", "png", "bmp", "tif", "tiff"};

    private final RestorationSettings settings;
    private final AsyncTaskRunner runner;
    private final PreviewRenderer renderer = new PreviewRenderer();
    private final LoggingListener listener = new LoggingListener();

    // Set on the event thread before each submit, read by the restoration thread.
    private volatile WorkerCommand worker;

    private JTextField pathField;
    private JTextField outputField;
    private JTextField deviceField;
    private JTextField interpreterField;
    private JCheckBox withScratchBox;
    private JCheckBox hrBox;
    private JButton runButton;
    private JLabel statusLabel;
    private JLabel statusBar;
    private PreviewPane inputPane;
    private PreviewPane outputPane;

    public PhotoRestoreGUI(RestorationSettings settings) {
        this.settings = settings;
        this.worker = settings.workerCommand();
        this.runner = new AsyncTaskRunner(this::restore, SwingUtilities::invokeLater);
        initializeGUI();
    }

    // Restoration thread.
    private JobResult restore(JobRequest request) {
        RestorationService service =
                new RestorationService.RestorationServiceBuilder()
                        .withLauncher(new JobLauncher(worker))
                        .withListener(listener)
                        .build();
        return service.execute(request);
    }

    private void initializeGUI() {
        setTitle(APP_TITLE);
        setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
        setMinimumSize(new Dimension(1100, 650));
        setLayout(new BorderLayout());
        addWindowListener(
                new java.awt.event.WindowAdapter() {
                    @Override
                    public void windowClosed(java.awt.event.WindowEvent e) {
                        runner.shutdown();
                    }
                });

        JPanel controls = new JPanel();
        controls.setLayout(new BoxLayout(controls, BoxLayout.Y_AXIS));
        controls.add(createInputPanel());
        controls.add(createOptionsPanel());
        controls.add(createWorkerPanel());
        controls.add(createActionsPanel());
        add(controls, BorderLayout.NORTH);

        add(createPreviewPanel(), BorderLayout.CENTER);

        statusBar = new JLabel(STATUS_READY);
        statusBar.setOpaque(true);
        statusBar.setBackground(new Color(0xFF, 0xFF, 0xE0));
        statusBar.setBorder(BorderFactory.createBevelBorder(BevelBorder.LOWERED));
        add(statusBar, BorderLayout.SOUTH);

        pack();
        setLocationRelativeTo(null);
        setVisible(true);
    }

    private JPanel createInputPanel() {
        JPanel panel = new JPanel(new BorderLayout(6, 0));
        panel.setBorder(BorderFactory.createEmptyBorder(10, 10, 6, 10));
        panel.add(new JLabel("Input file:"), BorderLayout.WEST);

        pathField = new JTextField();
        pathField.setBorder(BorderFactory.createLineBorder(new Color(0x99, 0x99, 0x99)));
        panel.add(pathField, BorderLayout.CENTER);

        JButton browseButton = new JButton("Browse");
        browseButton.addActionListener(e -> browseForInput());
        panel.add(browseButton, BorderLayout.EAST);
        return panel;
    }

    private JPanel createOptionsPanel() {
        JobForm defaults = JobForm.defaults(settings);
        JPanel panel = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 0));
        withScratchBox = new JCheckBox("With scratch", defaults.repairScratches());
        hrBox = new JCheckBox("HR", defaults.highResolution());
        panel.add(withScratchBox);
        panel.add(hrBox);

        panel.add(new JLabel("GPU:"));
        deviceField = new JTextField(defaults.deviceText(), 4);
        deviceField.setToolTipText("Accelerator id, or -1 to run without one");
        panel.add(deviceField);
        return panel;
    }

    private JPanel createWorkerPanel() {
        JobForm defaults = JobForm.defaults(settings);
        JPanel panel = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));

        panel.add(new JLabel("Output folder:"));
        outputField = new JTextField(defaults.outputFolderText(), 28);
        panel.add(outputField);

        panel.add(new JLabel("Python:"));
        interpreterField = new JTextField(defaults.interpreterText(), 12);
        panel.add(interpreterField);
        return panel;
    }

    private JPanel createActionsPanel() {
        JPanel panel = new JPanel(new FlowLayout(FlowLayout.LEFT, 10, 6));

        runButton = new JButton("Modify Photo");
        runButton.addActionListener(e -> runJob());
        panel.add(runButton);

        JButton exitButton = new JButton("Exit");
        exitButton.addActionListener(e -> dispose());
        panel.add(exitButton);

        statusLabel = new JLabel(STATUS_READY);
        panel.add(statusLabel);
        return panel;
    }

    private JPanel createPreviewPanel() {
        JPanel panel = new JPanel(new GridLayout(1, 2, 10, 0));
        panel.setBorder(BorderFactory.createEmptyBorder(0, 10, 10, 10));
        inputPane = new PreviewPane("Input Preview");
        outputPane = new PreviewPane("Output Preview");
        panel.add(inputPane);
        panel.add(outputPane);
        return panel;
    }

    private void browseForInput() {
        JFileChooser chooser = new JFileChooser();
        chooser.setCurrentDirectory(new File("."));
        chooser.setFileSelectionMode(JFileChooser.FILES_AND_DIRECTORIES);
        chooser.setAcceptAllFileFilterUsed(true);
        chooser.setFileFilter(new FileNameExtensionFilter("Images", IMAGE_EXTENSIONS));

        if (chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            setSelectedInput(chooser.getSelectedFile().toPath());
        }
    }

    private void setSelectedInput(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        pathField.setText(path.toString());
        setStatus("Selected: " + name);
        setTitle(APP_TITLE + " - " + name);
        outputPane.clear();

        if (Files.isDirectory(path)) {
            inputPane.clear();
            return;
        }
        showPreview(inputPane, path);
    }

    private void runJob() {
        JobForm form =
                new JobForm(
                        pathField.getText(),
                        outputField.getText(),
                        deviceField.getText(),
                        interpreterField.getText(),
                        withScratchBox.isSelected(),
                        hrBox.isSelected());
        if (!form.hasInput()) {
            showError("Please choose an input file first.");
            return;
        }
        if (!Files.exists(form.inputPath())) {
            showError("Input not found: " + form.inputPath());
            return;
        }

        JobRequest request;
        try {
            request = form.toJobRequest(settings);
        } catch (IllegalArgumentException e) {
            showError(e.getMessage());
            return;
        }
        worker = form.toWorkerCommand(settings);

        runButton.setEnabled(false);
        setStatus(STATUS_RUNNING);
        logger.info("Starting restoration of {} with {}", request.inputPath(), worker);
        runner.submit(request, this::onJobDone);
    }

    private void onJobDone(JobResult result) {
        runButton.setEnabled(true);
        setStatus("");
        if (!result.isSuccess()) {
            showError(result.describeFailure());
            return;
        }
        showPreview(outputPane, result.outputFile());
    }

    private void showPreview(PreviewPane pane, Path path) {
        try {
            pane.display(renderer.render(path, pane.getSize()));
        } catch (PreviewException e) {
            logger.warn("Cannot preview {} in {}: {}", path, pane.title(), e.getMessage());
            showError(e.getMessage());
        }
    }

    private void setStatus(String text) {
        statusLabel.setText(text);
        statusBar.setText(text.isEmpty() ? " " : text);
    }

    private void showError(String message) {
        JOptionPane.showMessageDialog(this, message, "Error", JOptionPane.ERROR_MESSAGE);
    }

    public static void main(String[] args) {
        System.setProperty("apple.awt.application.name", "Photo Restore");
        RestorationSettings settings = RestorationSettings.loadDefault();
        logger.info(
                "Worker installation root {}, output root {}",
                settings.installRoot(),
                settings.outputRoot());
        SwingUtilities.invokeLater(() -> new PhotoRestoreGUI(settings));
    }
}
