package dumb.ribbon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.ribbon.GridAllocator.Mode;
import dumb.ribbon.GridAllocator.Placement;
import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.NotFoundException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.table.DefaultTableModel;
import javax.swing.tree.DefaultMutableTreeNode;
import java.awt.*;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.util.*;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * A titled region of a category that packs controls on a grid. Every control
 * asks the panel's {@link GridAllocator} for a span and is then laid out at the
 * returned cell. Cells are never reclaimed, even after {@link #removeWidget}.
 */
public class Panel extends JPanel {
    private static final Logger logger = LoggerFactory.getLogger(Panel.class);
    private static final Map<String, Object> NO_ARGS = Map.of();

    private final RibbonConfig.PanelSettings cfg;
    private final JPanel actions = new JPanel(new GridBagLayout());
    private final JLabel titleLabel;
    private final JButton optionButton;
    private final List<Entry> entries = new ArrayList<>();
    private final List<ActionListener> optionListeners = new CopyOnWriteArrayList<>();
    private GridAllocator grid;
    private @Nullable Category category;
    private int maxRows, largeRows, mediumRows, smallRows;

    public Panel() {
        this("");
    }

    public Panel(String title) {
        this(title, RibbonConfig.get().panel.maxRows, true);
    }

    public Panel(String title, int maxRows, boolean showPanelOptionButton) {
        super(new BorderLayout(0, RibbonConfig.get().panel.spacing));
        this.cfg = RibbonConfig.get().panel;
        this.grid = new GridAllocator(maxRows);
        initRows(maxRows);

        setBorder(new EmptyBorder(2, 5, 2, 5));
        actions.setOpaque(false);
        add(actions, BorderLayout.CENTER);

        var titleBar = new JPanel(new BorderLayout(cfg.spacing, 0));
        titleBar.setOpaque(false);
        titleBar.setPreferredSize(new Dimension(0, cfg.titleHeight));
        titleLabel = new JLabel(title, SwingConstants.CENTER);
        titleBar.add(titleLabel, BorderLayout.CENTER);

        optionButton = new JButton("↘");
        optionButton.setToolTipText("Panel options");
        optionButton.setMargin(new Insets(0, 2, 0, 2));
        optionButton.setBorderPainted(false);
        optionButton.setFocusable(false);
        optionButton.addActionListener(e -> optionListeners.forEach(l -> l.actionPerformed(e)));
        optionButton.setVisible(showPanelOptionButton);
        titleBar.add(optionButton, BorderLayout.EAST);
        add(titleBar, BorderLayout.SOUTH);
    }

    private void initRows(int maxRows) {
        this.maxRows = maxRows;
        this.largeRows = maxRows;
        this.mediumRows = Math.max((int) Math.rint(maxRows / 2.0), 1);
        this.smallRows = Math.max((int) Math.rint(maxRows / 3.0), 1);
    }

    public int maximumRows() {
        return maxRows;
    }

    public int largeRows() {
        return largeRows;
    }

    public int mediumRows() {
        return mediumRows;
    }

    public int smallRows() {
        return smallRows;
    }

    /**
     * Changes the row count of a panel that holds no widgets yet; the size
     * classes are recomputed from the new count.
     *
     * @throws ConfigurationException once a widget has been placed
     */
    public void setMaximumRows(int maxRows) {
        if (grid.hasPlacements())
            throw new ConfigurationException("Set the maximum rows when creating the panel; widgets have already been added to '" + title() + "'");
        grid.setRowCount(maxRows);
        initRows(maxRows);
    }

    public void setLargeRows(int rows) {
        largeRows = checkRows(rows);
    }

    public void setMediumRows(int rows) {
        mediumRows = checkRows(rows);
    }

    public void setSmallRows(int rows) {
        smallRows = checkRows(rows);
    }

    private int checkRows(int rows) {
        if (rows <= 0 || rows > maxRows)
            throw new ConfigurationException("Invalid number of rows " + rows + ", must be in 1.." + maxRows);
        return rows;
    }

    public String title() {
        return titleLabel.getText();
    }

    /**
     * @throws ConfigurationException if the owning category already has a panel with this title
     */
    public void setTitle(String title) {
        if (category != null) category.retitle(this, title);
        titleLabel.setText(title);
    }

    void attach(@Nullable Category category) {
        this.category = category;
    }

    public JButton panelOptionButton() {
        return optionButton;
    }

    public void setPanelOptionToolTip(String text) {
        optionButton.setToolTipText(text);
    }

    public void addPanelOptionListener(ActionListener l) {
        optionListeners.add(l);
    }

    public void removePanelOptionListener(ActionListener l) {
        optionListeners.remove(l);
    }

    /** Columns opened so far by the panel's grid. */
    public int columnCount() {
        return grid.columnCount();
    }

    /** Height of one grid row at the current size, or 0 before the panel has been laid out. */
    public int rowHeight() {
        var h = (actions.getHeight() - cfg.spacing * (maxRows - 1)) / maxRows;
        return Math.max(h, 0);
    }

    public <T extends JComponent> T addWidget(T widget) {
        return addWidget(widget, smallRows, 1, Mode.COLUMN_WISE, GridBagConstraints.CENTER);
    }

    public <T extends JComponent> T addWidget(T widget, int rowSpan, int colSpan, Mode mode) {
        return addWidget(widget, rowSpan, colSpan, mode, GridBagConstraints.CENTER);
    }

    /**
     * Reserves {@code rowSpan x colSpan} cells and lays {@code widget} out there.
     *
     * @param anchor a {@link GridBagConstraints} anchor constant
     */
    public <T extends JComponent> T addWidget(T widget, int rowSpan, int colSpan, Mode mode, int anchor) {
        requireNonNull(widget);
        var at = grid.requestCells(rowSpan, colSpan, mode);

        var rh = rowHeight();
        if (rh > 0)
            widget.setMaximumSize(new Dimension(widget.getMaximumSize().width, rh * rowSpan + cfg.spacing * (rowSpan - 1)));

        var item = new Item(widget);
        var half = cfg.spacing / 2;
        actions.add(item, new GridBagConstraints(at.col(), at.row(), colSpan, rowSpan, 0, 0,
                anchor, GridBagConstraints.NONE, new Insets(half, half, half, half), 0, 0));
        entries.add(new Entry(widget, item, at, rowSpan, colSpan));
        actions.revalidate();
        logger.debug("{} placed {} at {} spanning {}x{}", this, widget.getClass().getSimpleName(), at, rowSpan, colSpan);
        return widget;
    }

    public <T extends JComponent> T addSmallWidget(T widget) {
        return addWidget(widget, smallRows, 1, Mode.COLUMN_WISE);
    }

    public <T extends JComponent> T addSmallWidget(T widget, Mode mode) {
        return addWidget(widget, smallRows, 1, mode);
    }

    public <T extends JComponent> T addMediumWidget(T widget) {
        return addWidget(widget, mediumRows, 1, Mode.COLUMN_WISE);
    }

    public <T extends JComponent> T addMediumWidget(T widget, Mode mode) {
        return addWidget(widget, mediumRows, 1, mode);
    }

    public <T extends JComponent> T addLargeWidget(T widget) {
        return addWidget(widget, largeRows, 1, Mode.COLUMN_WISE);
    }

    public <T extends JComponent> T addLargeWidget(T widget, Mode mode) {
        return addWidget(widget, largeRows, 1, mode);
    }

    /**
     * Removes a placed widget, or the placed scroll pane that contains it, from
     * view. Its grid cells stay reserved.
     */
    public void removeWidget(Component widget) {
        var e = entryOf(widget);
        actions.remove(e.item);
        entries.remove(e);
        actions.revalidate();
        actions.repaint();
    }

    public JComponent widget(int index) {
        if (index < 0 || index >= entries.size())
            throw new NotFoundException("No widget at index " + index + " in panel '" + title() + "'");
        return entries.get(index).widget;
    }

    public List<JComponent> widgets() {
        return entries.stream().map(Entry::widget).toList();
    }

    /** Top-left grid cell a widget was placed at. */
    public Placement placementOf(Component widget) {
        return entryOf(widget).at;
    }

    private Entry entryOf(Component widget) {
        for (var e : entries)
            if (e.widget == widget || SwingUtilities.isDescendingFrom(widget, e.widget)) return e;
        throw new NotFoundException("Widget not in panel '" + title() + "'");
    }

    /** Constraints the layout holds for a placed widget; for inspection. */
    GridBagConstraints constraintsOf(Component widget) {
        return ((GridBagLayout) actions.getLayout()).getConstraints(entryOf(widget).item);
    }

    /**
     * Builds widgets from descriptions keyed by name and returns them by name in
     * the same order.
     */
    public Map<String, JComponent> addWidgetsBy(Map<String, WidgetKind.Spec> data) {
        data.forEach((name, spec) -> {
            if (spec == null) throw new NotFoundException("No widget spec for '" + name + "'");
        });
        var widgets = new LinkedHashMap<String, JComponent>();
        data.forEach((name, spec) -> widgets.put(name, spec.type().build(this, spec.arguments())));
        return widgets;
    }

    /**
     * JSON form of {@link #addWidgetsBy(Map)}:
     * <pre>{"name": {"type": "LargeButton", "arguments": {"text": "Open"}}}</pre>
     */
    public Map<String, JComponent> addWidgetsBy(JsonNode data) {
        var specs = new LinkedHashMap<String, WidgetKind.Spec>();
        data.fields().forEachRemaining(f -> {
            var node = f.getValue();
            var kind = WidgetKind.fromString(node.path("type").asText(""));
            Map<String, Object> args = node.has("arguments")
                    ? RibbonConfig.json.convertValue(node.get("arguments"), new TypeReference<Map<String, Object>>() {
            })
                    : NO_ARGS;
            specs.put(f.getKey(), new WidgetKind.Spec(kind, args));
        });
        return addWidgetsBy(specs);
    }

    public JButton addButton(String text, @Nullable Icon icon, ButtonStyle style, boolean showText, int colSpan,
                             @Nullable ActionListener slot, @Nullable KeyStroke shortcut, @Nullable String tooltip,
                             Mode mode, int anchor) {
        var button = setupButton(new JButton(text), icon, style, showText, slot, shortcut, tooltip);
        return addWidget(button, style.rows(this), colSpan, mode, anchor);
    }

    public JButton addButton(String text, @Nullable Icon icon, ButtonStyle style, @Nullable ActionListener slot) {
        return addButton(text, icon, style, true, 1, slot, null, null, Mode.COLUMN_WISE, GridBagConstraints.CENTER);
    }

    public JButton addSmallButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addButton(text, icon, ButtonStyle.SMALL, slot);
    }

    public JButton addMediumButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addButton(text, icon, ButtonStyle.MEDIUM, slot);
    }

    public JButton addLargeButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addButton(text, icon, ButtonStyle.LARGE, slot);
    }

    public JToggleButton addToggleButton(String text, @Nullable Icon icon, ButtonStyle style, boolean showText, int colSpan,
                                         @Nullable ActionListener slot, @Nullable KeyStroke shortcut, @Nullable String tooltip,
                                         Mode mode, int anchor) {
        var button = setupButton(new JToggleButton(text), icon, style, showText, slot, shortcut, tooltip);
        return addWidget(button, style.rows(this), colSpan, mode, anchor);
    }

    public JToggleButton addToggleButton(String text, @Nullable Icon icon, ButtonStyle style, @Nullable ActionListener slot) {
        return addToggleButton(text, icon, style, true, 1, slot, null, null, Mode.COLUMN_WISE, GridBagConstraints.CENTER);
    }

    public JToggleButton addSmallToggleButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addToggleButton(text, icon, ButtonStyle.SMALL, slot);
    }

    public JToggleButton addMediumToggleButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addToggleButton(text, icon, ButtonStyle.MEDIUM, slot);
    }

    public JToggleButton addLargeToggleButton(String text, @Nullable Icon icon, @Nullable ActionListener slot) {
        return addToggleButton(text, icon, ButtonStyle.LARGE, slot);
    }

    private <B extends AbstractButton> B setupButton(B button, @Nullable Icon icon, ButtonStyle style, boolean showText,
                                                    @Nullable ActionListener slot, @Nullable KeyStroke shortcut,
                                                    @Nullable String tooltip) {
        if (tooltip != null && !tooltip.isEmpty()) button.setToolTipText(tooltip);
        style.apply(button, icon, showText, cfg);
        if (slot != null) button.addActionListener(slot);
        if (shortcut != null) {
            var key = "ribbon-shortcut";
            button.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW).put(shortcut, key);
            button.getActionMap().put(key, new AbstractAction() {
                @Override
                public void actionPerformed(ActionEvent e) {
                    button.doClick();
                }
            });
        }
        return button;
    }

    public JComboBox<String> addComboBox(List<String> items) {
        return addComboBox(items, smallRows, 1, Mode.COLUMN_WISE);
    }

    public JComboBox<String> addComboBox(List<String> items, int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JComboBox<>(items.toArray(new String[0])), rowSpan, colSpan, mode);
    }

    public JComboBox<String> addFontComboBox() {
        return addFontComboBox(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JComboBox<String> addFontComboBox(int rowSpan, int colSpan, Mode mode) {
        var fonts = GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames();
        var combo = new JComboBox<>(fonts);
        combo.setSelectedItem(UIManager.getFont("Label.font") != null ? UIManager.getFont("Label.font").getFamily() : Font.DIALOG);
        return addWidget(combo, rowSpan, colSpan, mode);
    }

    public JTextField addLineEdit() {
        return addLineEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JTextField addLineEdit(int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JTextField(12), rowSpan, colSpan, mode);
    }

    public JTextPane addTextEdit() {
        return addTextEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JTextPane addTextEdit(int rowSpan, int colSpan, Mode mode) {
        var text = new JTextPane();
        addWidget(new JScrollPane(text), rowSpan, colSpan, mode);
        return text;
    }

    public JTextArea addPlainTextEdit() {
        return addPlainTextEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JTextArea addPlainTextEdit(int rowSpan, int colSpan, Mode mode) {
        var text = new JTextArea(2, 12);
        text.setLineWrap(true);
        text.setWrapStyleWord(true);
        addWidget(new JScrollPane(text), rowSpan, colSpan, mode);
        return text;
    }

    public JLabel addLabel(String text) {
        return addLabel(text, smallRows, 1, Mode.COLUMN_WISE);
    }

    public JLabel addLabel(String text, int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JLabel(text), rowSpan, colSpan, mode);
    }

    public JProgressBar addProgressBar() {
        return addProgressBar(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JProgressBar addProgressBar(int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JProgressBar(), rowSpan, colSpan, mode);
    }

    public JSlider addSlider() {
        return addSlider(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSlider addSlider(int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JSlider(SwingConstants.HORIZONTAL), rowSpan, colSpan, mode);
    }

    public JSpinner addSpinBox() {
        return addSpinBox(0, 0, 99, 1, smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSpinner addSpinBox(int value, int minimum, int maximum, int step, int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JSpinner(new SpinnerNumberModel(value, minimum, maximum, step)), rowSpan, colSpan, mode);
    }

    public JSpinner addDoubleSpinBox() {
        return addDoubleSpinBox(0.0, 0.0, 99.99, 1.0, smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSpinner addDoubleSpinBox(double value, double minimum, double maximum, double step, int rowSpan, int colSpan, Mode mode) {
        return addWidget(new JSpinner(new SpinnerNumberModel(value, minimum, maximum, step)), rowSpan, colSpan, mode);
    }

    public JSpinner addDateEdit() {
        return addDateEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSpinner addDateEdit(int rowSpan, int colSpan, Mode mode) {
        return addWidget(dateSpinner("yyyy-MM-dd"), rowSpan, colSpan, mode);
    }

    public JSpinner addTimeEdit() {
        return addTimeEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSpinner addTimeEdit(int rowSpan, int colSpan, Mode mode) {
        return addWidget(dateSpinner("HH:mm:ss"), rowSpan, colSpan, mode);
    }

    public JSpinner addDateTimeEdit() {
        return addDateTimeEdit(smallRows, 1, Mode.COLUMN_WISE);
    }

    public JSpinner addDateTimeEdit(int rowSpan, int colSpan, Mode mode) {
        return addWidget(dateSpinner("yyyy-MM-dd HH:mm:ss"), rowSpan, colSpan, mode);
    }

    private static JSpinner dateSpinner(String pattern) {
        var spinner = new JSpinner(new SpinnerDateModel());
        spinner.setEditor(new JSpinner.DateEditor(spinner, pattern));
        return spinner;
    }

    public JTable addTableWidget() {
        return addTableWidget(largeRows, 1, Mode.COLUMN_WISE);
    }

    public JTable addTableWidget(int rowSpan, int colSpan, Mode mode) {
        var table = new JTable(new DefaultTableModel());
        addWidget(new JScrollPane(table), rowSpan, colSpan, mode);
        return table;
    }

    public JTree addTreeWidget() {
        return addTreeWidget(largeRows, 1, Mode.COLUMN_WISE);
    }

    public JTree addTreeWidget(int rowSpan, int colSpan, Mode mode) {
        var tree = new JTree(new DefaultMutableTreeNode());
        tree.setRootVisible(false);
        addWidget(new JScrollPane(tree), rowSpan, colSpan, mode);
        return tree;
    }

    public JList<String> addListWidget() {
        return addListWidget(largeRows, 1, Mode.COLUMN_WISE);
    }

    public JList<String> addListWidget(int rowSpan, int colSpan, Mode mode) {
        var list = new JList<>(new DefaultListModel<String>());
        addWidget(new JScrollPane(list), rowSpan, colSpan, mode);
        return list;
    }

    /** @param orientation {@link SwingConstants#HORIZONTAL} or {@link SwingConstants#VERTICAL} */
    public JSeparator addSeparator(int orientation, int width, int rowSpan, int colSpan, Mode mode) {
        var sep = new JSeparator(orientation);
        sep.setPreferredSize(orientation == SwingConstants.VERTICAL ? new Dimension(width, 0) : new Dimension(0, width));
        return addWidget(sep, rowSpan, colSpan, mode);
    }

    public JSeparator addHorizontalSeparator() {
        return addSeparator(SwingConstants.HORIZONTAL, 6, 1, 2, Mode.COLUMN_WISE);
    }

    public JSeparator addVerticalSeparator() {
        return addSeparator(SwingConstants.VERTICAL, 6, largeRows, 1, Mode.COLUMN_WISE);
    }

    public Gallery addGallery() {
        return addGallery(800, false, largeRows, 1, Mode.COLUMN_WISE);
    }

    public Gallery addGallery(int minimumWidth, boolean popupHideOnClick, int rowSpan, int colSpan, Mode mode) {
        return addWidget(new Gallery(minimumWidth, popupHideOnClick), rowSpan, colSpan, mode);
    }

    @Override
    public String toString() {
        return "Panel[" + title() + "]";
    }

    /** Centers a placed widget inside its grid cell. */
    static class Item extends JPanel {
        Item(JComponent widget) {
            super(new GridBagLayout());
            setOpaque(false);
            add(widget);
        }
    }

    private record Entry(JComponent widget, Item item, Placement at, int rowSpan, int colSpan) {
    }
}
