package dumb.ribbon;

import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.NotFoundException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.awt.event.ActionListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One tab of a ribbon: a horizontally scrolling row of panels followed by a
 * display options button. A {@link Style#CONTEXTUAL} category carries a color
 * and is only shown while its owner says so.
 */
public class Category extends JPanel {
    private static final Logger logger = LoggerFactory.getLogger(Category.class);

    private final String title;
    private final @Nullable Ribbon ribbon;
    private final Map<String, Panel> panels = new LinkedHashMap<>();
    private final Map<Panel, JSeparator> separators = new LinkedHashMap<>();
    private final JPanel panelRow = new JPanel();
    private final JButton displayOptionsButton = new JButton("⌄");
    private Style style;
    private @Nullable Color color;
    private @Nullable JPopupMenu displayOptionsMenu;

    public Category(String title) {
        this(title, Style.NORMAL, null, null);
    }

    public Category(String title, Style style, @Nullable Color color, @Nullable Ribbon ribbon) {
        super(new BorderLayout());
        this.title = title;
        this.style = style;
        this.color = color;
        this.ribbon = ribbon;
        setBackground(Color.WHITE);

        panelRow.setLayout(new BoxLayout(panelRow, BoxLayout.X_AXIS));
        panelRow.setOpaque(false);
        panelRow.add(Box.createHorizontalGlue());
        var scroll = new JScrollPane(panelRow, ScrollPaneConstants.VERTICAL_SCROLLBAR_NEVER, ScrollPaneConstants.HORIZONTAL_SCROLLBAR_AS_NEEDED);
        scroll.setBorder(BorderFactory.createEmptyBorder());
        scroll.setOpaque(false);
        scroll.getViewport().setOpaque(false);
        add(scroll, BorderLayout.CENTER);

        displayOptionsButton.setToolTipText("Ribbon Display Options");
        displayOptionsButton.setMargin(new Insets(0, 2, 0, 2));
        displayOptionsButton.setBorderPainted(false);
        displayOptionsButton.setFocusable(false);
        displayOptionsButton.addActionListener(e -> {
            if (displayOptionsMenu != null && displayOptionsButton.isShowing())
                displayOptionsMenu.show(displayOptionsButton, 0, displayOptionsButton.getHeight());
        });
        var optionsColumn = new JPanel(new BorderLayout());
        optionsColumn.setOpaque(false);
        optionsColumn.add(displayOptionsButton, BorderLayout.SOUTH);
        add(optionsColumn, BorderLayout.EAST);
    }

    public String title() {
        return title;
    }

    public @Nullable Ribbon ribbon() {
        return ribbon;
    }

    public Style categoryStyle() {
        return style;
    }

    public void setCategoryStyle(Style style) {
        if (this.style == style) return;
        this.style = style;
        if (ribbon != null) ribbon.categoryChanged(this);
        repaint();
    }

    public boolean isContextual() {
        return style == Style.CONTEXTUAL;
    }

    /** Tint of a contextual category; null for normal ones. */
    public @Nullable Color color() {
        return color;
    }

    public void setColor(@Nullable Color color) {
        if (Objects.equals(this.color, color)) return;
        this.color = color;
        if (ribbon != null) ribbon.categoryChanged(this);
        repaint();
    }

    public void showContextCategory() {
        if (ribbon != null) ribbon.showContextCategory(this);
    }

    public void hideContextCategory() {
        if (ribbon != null) ribbon.hideContextCategory(this);
    }

    public void setCategoryState(boolean shown) {
        if (shown) showContextCategory();
        else hideContextCategory();
    }

    /** Whether the owning ribbon currently has a tab for this category. */
    public boolean isShown() {
        return ribbon != null && ribbon.visibleCategories().contains(this);
    }

    public Panel addPanel(String title) {
        return addPanel(title, RibbonConfig.get().panel.maxRows, true);
    }

    /**
     * @throws ConfigurationException if a panel with this title already exists
     */
    public Panel addPanel(String title, int maxRows, boolean showPanelOptionButton) {
        if (panels.containsKey(title))
            throw new ConfigurationException("Panel '" + title + "' already exists in category '" + this.title + "'");
        var panel = new Panel(title, maxRows, showPanelOptionButton);
        panels.put(title, panel);
        panel.attach(this);

        var line = new JSeparator(SwingConstants.VERTICAL);
        line.setMaximumSize(new Dimension(2, Integer.MAX_VALUE));
        var glue = panelRow.getComponentCount() - 1;
        panelRow.add(panel, glue);
        panelRow.add(line, glue + 1);
        separators.put(panel, line);
        panelRow.revalidate();
        logger.debug("Added panel '{}' to category '{}'", title, this.title);
        return panel;
    }

    public Panel panel(String title) {
        var panel = panels.get(title);
        if (panel == null) throw new NotFoundException("No panel '" + title + "' in category '" + this.title + "'");
        return panel;
    }

    public List<Panel> panels() {
        return new ArrayList<>(panels.values());
    }

    public void removePanel(String title) {
        takePanel(title);
    }

    public Panel takePanel(String title) {
        var panel = panel(title);
        panels.remove(title);
        panel.attach(null);
        panelRow.remove(panel);
        var line = separators.remove(panel);
        if (line != null) panelRow.remove(line);
        panelRow.revalidate();
        panelRow.repaint();
        return panel;
    }

    /** Re-keys {@code panel} under {@code title}, keeping its position. */
    void retitle(Panel panel, String title) {
        var old = panel.title();
        if (old.equals(title)) return;
        if (panels.containsKey(title))
            throw new ConfigurationException("Panel '" + title + "' already exists in category '" + this.title + "'");
        var renamed = new LinkedHashMap<String, Panel>();
        panels.forEach((k, p) -> renamed.put(p == panel ? title : k, p));
        panels.clear();
        panels.putAll(renamed);
    }

    public JButton displayOptionsButton() {
        return displayOptionsButton;
    }

    public void addDisplayOptionsListener(ActionListener l) {
        displayOptionsButton.addActionListener(l);
    }

    public void setDisplayOptionsButtonMenu(@Nullable JPopupMenu menu) {
        this.displayOptionsMenu = menu;
    }

    public @Nullable JPopupMenu displayOptionsButtonMenu() {
        return displayOptionsMenu;
    }

    @Override
    public String toString() {
        return "Category[" + title + (isContextual() ? ", contextual" : "") + "]";
    }

    public enum Style {NORMAL, CONTEXTUAL}
}
