package dumb.ribbon;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.ribbon.RibbonException.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.io.IOException;

/** A frame with a ribbon on top and an empty central area. */
public class RibbonMainWindow extends JFrame {
    private static final Logger logger = LoggerFactory.getLogger(RibbonMainWindow.class);

    final Ribbon ribbon;
    final JPanel central = new JPanel(new BorderLayout());

    public RibbonMainWindow(String title) {
        super(title);
        ribbon = new Ribbon();
        setLayout(new BorderLayout());
        add(ribbon, BorderLayout.NORTH);
        add(central, BorderLayout.CENTER);
        setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
    }

    public Ribbon ribbon() {
        return ribbon;
    }

    public JPanel centralPanel() {
        return central;
    }

    public static void main(String[] args) {
        try {
            UIManager.setLookAndFeel("javax.swing.plaf.nimbus.NimbusLookAndFeel");
        } catch (Exception ex) {
            logger.warn("Failed to initialize LaF: {}", ex.getMessage());
        }
        SwingUtilities.invokeLater(() -> {
            var window = new RibbonMainWindow("Ribbon Demo");
            populateDemo(window.ribbon(), window.centralPanel());
            window.setSize(1200, 600);
            window.setLocationRelativeTo(null);
            window.setVisible(true);
        });
    }

    /** Fills {@code ribbon} with a Home category built from {@code demo-ribbon.json} and a contextual Table category. */
    static void populateDemo(Ribbon ribbon, JPanel central) {
        var status = new JLabel(" ");
        central.add(status, BorderLayout.SOUTH);

        var fileMenu = new JPopupMenu();
        fileMenu.add(new JMenuItem("Open"));
        fileMenu.add(new JMenuItem("Save"));
        fileMenu.addSeparator();
        fileMenu.add(new JMenuItem("Exit")).addActionListener(e -> System.exit(0));
        ribbon.setFileMenu(fileMenu);
        ribbon.addQuickAccessButton(new JButton("💾"));
        ribbon.addRibbonListener(e -> status.setText(e.type() + (e.data() != null ? ": " + e.data() : "")));

        var home = ribbon.addCategory("Home");
        var clipboard = home.addPanel("Clipboard");
        clipboard.addWidgetsBy(demoWidgets());

        var table = ribbon.addContextCategory("Table");
        table.addPanel("Layout").addLargeButton("Insert Row", null, e -> status.setText("Row inserted"));

        var view = home.addPanel("View");
        var tableTools = view.addLargeToggleButton("Table Tools", null, null);
        tableTools.addActionListener(e -> table.setCategoryState(tableTools.isSelected()));
        view.addSmallButton("Zoom In", null, null);
        view.addSmallButton("Zoom Out", null, null);
        view.addSlider();

        ribbon.addCategory("Insert").addPanel("Shapes").addGallery(400, true, view.largeRows(), 1, GridAllocator.Mode.COLUMN_WISE);
    }

    private static JsonNode demoWidgets() {
        try (var in = RibbonMainWindow.class.getResourceAsStream("/demo-ribbon.json")) {
            if (in == null) throw new ConfigurationException("Missing /demo-ribbon.json");
            return RibbonConfig.json.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable /demo-ribbon.json", e);
        }
    }
}
