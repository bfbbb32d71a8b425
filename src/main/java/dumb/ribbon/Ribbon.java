package dumb.ribbon;

import dumb.ribbon.Category.Style;
import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.NotFoundException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The command bar: application button, quick access bar, a row of category
 * tabs and the stacked categories below it. At most one category is visible at
 * a time. Contextual categories start hidden and get a tab only while shown.
 * <p>
 * Not thread safe; use from the event dispatch thread.
 */
public class Ribbon extends JPanel {
    private static final Logger logger = LoggerFactory.getLogger(Ribbon.class);

    private final RibbonConfig cfg;
    private final List<Category> categories = new ArrayList<>();
    private final Set<Category> shownContexts = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Category, JToggleButton> tabButtons = new IdentityHashMap<>();
    private final Map<Category, String> cards = new IdentityHashMap<>();
    private final List<Consumer<RibbonEvent>> listeners = new CopyOnWriteArrayList<>();

    private final JPanel tabsWidget = new JPanel(new BorderLayout(5, 0));
    private final JPanel tabBar = new JPanel(new FlowLayout(FlowLayout.LEFT, 0, 0));
    private final ButtonGroup tabGroup = new ButtonGroup();
    private final CardLayout cardLayout = new CardLayout();
    private final JPanel stack = new JPanel(cardLayout);
    private final JButton applicationButton;
    private final JToolBar quickAccessBar = new JToolBar();
    private final JPanel rightButtons = new JPanel(new FlowLayout(FlowLayout.RIGHT, 5, 0));
    private final JButton collapseButton = new JButton("⌃");
    private final JButton helpButton = new JButton("?");
    private JPopupMenu fileMenu = new JPopupMenu();
    private @Nullable Category current;
    private boolean collapsed = false;
    private int ribbonHeight;
    private int cardSeq = 0;
    private int contextSeq = 0;

    public Ribbon() {
        this(RibbonConfig.get());
    }

    public Ribbon(RibbonConfig cfg) {
        super(new BorderLayout(0, 5));
        this.cfg = cfg;
        this.ribbonHeight = cfg.ribbon.height;

        applicationButton = new JButton(cfg.ribbon.fileTitle);
        applicationButton.setToolTipText(cfg.ribbon.fileTitle);
        applicationButton.setFocusable(false);
        applicationButton.addActionListener(e -> {
            if (applicationButton.isShowing())
                fileMenu.show(applicationButton, 0, applicationButton.getHeight());
        });

        quickAccessBar.setFloatable(false);
        quickAccessBar.setOrientation(SwingConstants.HORIZONTAL);
        quickAccessBar.setBorderPainted(false);

        var tabFont = tabBar.getFont();
        if (tabFont != null) tabBar.setFont(tabFont.deriveFont((float) cfg.ribbon.tabFontSize));

        collapseButton.setToolTipText("Collapse Ribbon");
        collapseButton.setFocusable(false);
        collapseButton.addActionListener(e -> setCollapsed(!collapsed));
        helpButton.setToolTipText("Help");
        helpButton.setFocusable(false);
        helpButton.addActionListener(e -> fire(RibbonEvent.Type.HELP_REQUESTED, null));
        rightButtons.add(collapseButton);
        rightButtons.add(helpButton);

        var left = new JPanel(new FlowLayout(FlowLayout.LEFT, 0, 0));
        left.add(applicationButton);
        left.add(quickAccessBar);
        left.add(tabBar);
        tabsWidget.add(left, BorderLayout.CENTER);
        tabsWidget.add(rightButtons, BorderLayout.EAST);

        add(tabsWidget, BorderLayout.NORTH);
        add(stack, BorderLayout.CENTER);
    }

    public Category addCategory(String title) {
        return addCategory(title, Style.NORMAL);
    }

    /** Adds a category at the end. Contextual ones get the next palette color and stay hidden until shown. */
    public Category addCategory(String title, Style style) {
        var color = style == Style.CONTEXTUAL ? cfg.contextualColor(contextSeq++) : null;
        return addCategory(title, style, color);
    }

    public Category addContextCategory(String title) {
        return addCategory(title, Style.CONTEXTUAL);
    }

    public Category addContextCategory(String title, Color color) {
        return addCategory(title, Style.CONTEXTUAL, color);
    }

    private Category addCategory(String title, Style style, @Nullable Color color) {
        var category = new Category(title, style, color, this);
        categories.add(category);

        var key = "category-" + cardSeq++;
        cards.put(category, key);
        stack.add(category, key);

        var tab = new JToggleButton(title);
        tab.setFocusable(false);
        tab.setFont(tabBar.getFont());
        if (color != null) tint(tab, color);
        tab.addActionListener(e -> setCurrentCategory(category));
        tabGroup.add(tab);
        tabButtons.put(category, tab);

        rebuildTabs();
        logger.info("Added {} category '{}'", style.name().toLowerCase(), title);
        fire(RibbonEvent.Type.CATEGORY_ADDED, category);
        if (current == null && hasTab(category)) select(category);
        return category;
    }

    /**
     * @throws NotFoundException if the category does not belong to this ribbon
     */
    public void removeCategory(Category category) {
        var index = indexOf(category);
        var visibleIndex = visibleCategories().indexOf(category);
        categories.remove(index);
        shownContexts.remove(category);
        stack.remove(category);
        cards.remove(category);
        tabGroup.remove(tabButtons.remove(category));
        rebuildTabs();
        logger.info("Removed category '{}'", category.title());
        fire(RibbonEvent.Type.CATEGORY_REMOVED, category);
        if (current == category) selectNear(visibleIndex);
    }

    /** All categories in insertion order, hidden contextual ones included. */
    public List<Category> categories() {
        return Collections.unmodifiableList(categories);
    }

    /** Categories that currently have a tab, in tab order. */
    public List<Category> visibleCategories() {
        return categories.stream().filter(this::hasTab).toList();
    }

    private boolean hasTab(Category c) {
        return !c.isContextual() || shownContexts.contains(c);
    }

    public @Nullable Category currentCategory() {
        return current;
    }

    /** Tab index of the current category, -1 when there is none. */
    public int currentIndex() {
        return current == null ? -1 : visibleCategories().indexOf(current);
    }

    public void setCurrentIndex(int index) {
        var visible = visibleCategories();
        if (index < 0 || index >= visible.size()) throw new NotFoundException("No category tab at " + index);
        select(visible.get(index));
    }

    /**
     * @throws NotFoundException if the category is not part of this ribbon or is a hidden contextual category
     */
    public void setCurrentCategory(Category category) {
        indexOf(category);
        if (!hasTab(category))
            throw new NotFoundException("Contextual category '" + category.title() + "' is not shown");
        select(category);
    }

    /** Gives a contextual category a tab and selects it. Normal categories are left alone. */
    public void showContextCategory(Category category) {
        indexOf(category);
        if (!category.isContextual() || shownContexts.contains(category)) return;
        shownContexts.add(category);
        rebuildTabs();
        fire(RibbonEvent.Type.CONTEXT_CATEGORY_SHOWN, category);
        select(category);
    }

    public void hideContextCategory(Category category) {
        indexOf(category);
        if (!category.isContextual() || !shownContexts.contains(category)) return;
        var visibleIndex = visibleCategories().indexOf(category);
        shownContexts.remove(category);
        rebuildTabs();
        fire(RibbonEvent.Type.CONTEXT_CATEGORY_HIDDEN, category);
        if (current == category) selectNear(visibleIndex);
    }

    /**
     * Brings the tab of {@code category} in line with its current style and color.
     * Only contextual categories are tinted.
     * A category turned contextual loses its tab until shown; if it was current,
     * the nearest visible category takes over.
     */
    void categoryChanged(Category category) {
        var tab = tabButton(category);
        tint(tab, category.isContextual() ? category.color() : null);
        if (!category.isContextual()) shownContexts.remove(category);

        var visibleIndex = List.of(tabBar.getComponents()).indexOf(tab);
        rebuildTabs();
        if (current == category && !hasTab(category)) selectNear(visibleIndex);
        else if (current == null && hasTab(category)) select(category);
    }

    private static void tint(JToggleButton tab, @Nullable Color color) {
        if (color != null) {
            tab.setBackground(color);
            tab.setOpaque(true);
        } else {
            tab.setBackground(UIManager.getColor("ToggleButton.background"));
        }
        tab.repaint();
    }

    private int indexOf(Category category) {
        for (var i = 0; i < categories.size(); i++)
            if (categories.get(i) == category) return i;
        throw new NotFoundException(category + " does not belong to this ribbon");
    }

    /** Selects the tab that took over {@code visibleIndex}, or the one before it, or nothing. */
    private void selectNear(int visibleIndex) {
        var visible = visibleCategories();
        if (visible.isEmpty()) select(null);
        else select(visible.get(Math.min(Math.max(visibleIndex, 0), visible.size() - 1)));
    }

    private void select(@Nullable Category category) {
        if (category == current) return;
        current = category;
        if (category != null) {
            cardLayout.show(stack, cards.get(category));
            tabButtons.get(category).setSelected(true);
        } else {
            tabGroup.clearSelection();
        }
        fire(RibbonEvent.Type.CURRENT_CATEGORY_CHANGED, category);
    }

    private void rebuildTabs() {
        tabBar.removeAll();
        for (var c : visibleCategories()) tabBar.add(tabButtons.get(c));
        tabBar.revalidate();
        tabBar.repaint();
    }

    JToggleButton tabButton(Category category) {
        var tab = tabButtons.get(category);
        if (tab == null) throw new NotFoundException(category + " does not belong to this ribbon");
        return tab;
    }

    public boolean isCollapsed() {
        return collapsed;
    }

    /** Hides the categories leaving only the tab row, or shows them again. */
    public void setCollapsed(boolean collapsed) {
        if (this.collapsed == collapsed) return;
        this.collapsed = collapsed;
        stack.setVisible(!collapsed);
        collapseButton.setToolTipText(collapsed ? "Expand Ribbon" : "Collapse Ribbon");
        collapseButton.setText(collapsed ? "⌄" : "⌃");
        revalidate();
        fire(RibbonEvent.Type.COLLAPSED_CHANGED, collapsed);
    }

    public int ribbonHeight() {
        return ribbonHeight;
    }

    public void setRibbonHeight(int height) {
        if (height <= 0) throw new ConfigurationException("Ribbon height must be positive, got " + height);
        this.ribbonHeight = height;
        revalidate();
    }

    @Override
    public Dimension getPreferredSize() {
        var width = super.getPreferredSize().width;
        return new Dimension(width, collapsed ? tabsWidget.getPreferredSize().height : ribbonHeight);
    }

    @Override
    public Dimension getMinimumSize() {
        return new Dimension(super.getMinimumSize().width, getPreferredSize().height);
    }

    public JButton applicationButton() {
        return applicationButton;
    }

    public String fileTitle() {
        return applicationButton.getText();
    }

    public void setFileTitle(String title) {
        applicationButton.setText(title);
        applicationButton.setToolTipText(title);
    }

    public void setFileIcon(@Nullable Icon icon) {
        applicationButton.setIcon(icon);
    }

    public JPopupMenu fileMenu() {
        return fileMenu;
    }

    public void setFileMenu(JPopupMenu menu) {
        this.fileMenu = menu;
    }

    public void addQuickAccessButton(AbstractButton button) {
        button.setFocusable(false);
        quickAccessBar.add(button);
    }

    public List<Component> quickAccessButtons() {
        return List.of(quickAccessBar.getComponents());
    }

    /** Adds a button left of the collapse and help buttons. */
    public void addRightButton(AbstractButton button) {
        button.setFocusable(false);
        rightButtons.add(button, rightButtons.getComponentCount() - 2);
    }

    public List<Component> rightButtons() {
        return List.of(rightButtons.getComponents());
    }

    public JButton helpButton() {
        return helpButton;
    }

    public void setHelpButtonIcon(@Nullable Icon icon) {
        helpButton.setIcon(icon);
        if (icon != null) helpButton.setText("");
    }

    public void removeHelpButton() {
        helpButton.setVisible(false);
    }

    public JButton collapseButton() {
        return collapseButton;
    }

    public void setMinButtonIcon(@Nullable Icon icon) {
        collapseButton.setIcon(icon);
        if (icon != null) collapseButton.setText("");
    }

    public void removeMinButton() {
        collapseButton.setVisible(false);
    }

    public void addRibbonListener(Consumer<RibbonEvent> l) {
        listeners.add(l);
    }

    public void removeRibbonListener(Consumer<RibbonEvent> l) {
        listeners.remove(l);
    }

    private void fire(RibbonEvent.Type type, @Nullable Object data) {
        var event = new RibbonEvent(type, data);
        logger.debug("{}", event);
        listeners.forEach(l -> l.accept(event));
    }

    /**
     * Something changed in the ribbon. {@code data} is the affected category,
     * the new collapsed state for {@link Type#COLLAPSED_CHANGED}, or null.
     */
    public record RibbonEvent(Type type, @Nullable Object data) {
        public enum Type {
            CATEGORY_ADDED, CATEGORY_REMOVED, CURRENT_CATEGORY_CHANGED, CONTEXT_CATEGORY_SHOWN,
            CONTEXT_CATEGORY_HIDDEN, COLLAPSED_CHANGED, HELP_REQUESTED
        }
    }
}
