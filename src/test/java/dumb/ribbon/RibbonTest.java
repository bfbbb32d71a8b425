package dumb.ribbon;

import dumb.ribbon.Ribbon.RibbonEvent;
import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.swing.*;
import java.awt.*;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RibbonTest {

    private Ribbon ribbon;
    private final List<RibbonEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ribbon = new Ribbon();
        ribbon.addRibbonListener(events::add);
    }

    private List<RibbonEvent.Type> types() {
        return events.stream().map(RibbonEvent::type).toList();
    }

    @Test
    void emptyRibbonHasNoCurrentCategory() {
        assertNull(ribbon.currentCategory());
        assertEquals(-1, ribbon.currentIndex());
        assertEquals(270, ribbon.ribbonHeight());
        assertEquals("File", ribbon.fileTitle());
    }

    @Test
    void firstCategoryBecomesCurrent() {
        var home = ribbon.addCategory("Home");
        var insert = ribbon.addCategory("Insert");
        assertSame(home, ribbon.currentCategory());
        assertEquals(List.of(home, insert), ribbon.categories());
        assertEquals(List.of(RibbonEvent.Type.CATEGORY_ADDED, RibbonEvent.Type.CURRENT_CATEGORY_CHANGED,
                RibbonEvent.Type.CATEGORY_ADDED), types());
    }

    @Test
    void selectingByCategoryIndexAndTab() {
        var home = ribbon.addCategory("Home");
        var insert = ribbon.addCategory("Insert");
        ribbon.setCurrentCategory(insert);
        assertEquals(1, ribbon.currentIndex());
        ribbon.setCurrentIndex(0);
        assertSame(home, ribbon.currentCategory());
        ribbon.tabButton(insert).doClick(0);
        assertSame(insert, ribbon.currentCategory());
        assertTrue(ribbon.tabButton(insert).isSelected());
        assertThrows(NotFoundException.class, () -> ribbon.setCurrentIndex(2));
    }

    @Test
    void titlesNeedNotBeUnique() {
        var a = ribbon.addCategory("Tools");
        var b = ribbon.addCategory("Tools");
        assertNotSame(a, b);
        ribbon.setCurrentCategory(b);
        assertEquals(1, ribbon.currentIndex());
    }

    @Test
    void contextualCategoriesStartHiddenWithPaletteColors() {
        ribbon.addCategory("Home");
        var table = ribbon.addContextCategory("Table");
        var chart = ribbon.addContextCategory("Chart");
        assertEquals(new Color(0xc9599c), table.color());
        assertEquals(new Color(0xf2cb1d), chart.color());
        assertFalse(table.isShown());
        assertEquals(1, ribbon.visibleCategories().size());
        assertThrows(NotFoundException.class, () -> ribbon.setCurrentCategory(table));
    }

    @Test
    void showingAndHidingContextualCategory() {
        var home = ribbon.addCategory("Home");
        var table = ribbon.addContextCategory("Table");
        var insert = ribbon.addCategory("Insert");
        events.clear();

        table.showContextCategory();
        assertTrue(table.isShown());
        assertSame(table, ribbon.currentCategory());
        assertEquals(List.of(home, table, insert), ribbon.visibleCategories());
        assertEquals(1, ribbon.currentIndex());
        assertEquals(List.of(RibbonEvent.Type.CONTEXT_CATEGORY_SHOWN, RibbonEvent.Type.CURRENT_CATEGORY_CHANGED), types());

        table.setCategoryState(false);
        assertFalse(table.isShown());
        assertSame(insert, ribbon.currentCategory(), "the tab that moved into its place");
        assertEquals(List.of(home, insert), ribbon.visibleCategories());
    }

    @Test
    void showingTwiceIsHarmless() {
        ribbon.addCategory("Home");
        var table = ribbon.addContextCategory("Table");
        table.showContextCategory();
        events.clear();
        table.showContextCategory();
        assertTrue(events.isEmpty());
    }

    @Test
    void normalCategoriesIgnoreContextRequests() {
        var home = ribbon.addCategory("Home");
        home.hideContextCategory();
        assertTrue(home.isShown());
    }

    @Test
    void removingCurrentSelectsNeighbour() {
        var home = ribbon.addCategory("Home");
        var insert = ribbon.addCategory("Insert");
        var view = ribbon.addCategory("View");
        ribbon.setCurrentCategory(view);
        ribbon.removeCategory(view);
        assertSame(insert, ribbon.currentCategory());
        ribbon.removeCategory(home);
        assertSame(insert, ribbon.currentCategory());
        ribbon.removeCategory(insert);
        assertNull(ribbon.currentCategory());
        assertTrue(ribbon.categories().isEmpty());
    }

    @Test
    void foreignCategoryIsNotFound() {
        var other = new Ribbon().addCategory("Elsewhere");
        assertThrows(NotFoundException.class, () -> ribbon.removeCategory(other));
        assertThrows(NotFoundException.class, () -> ribbon.setCurrentCategory(other));
        assertThrows(NotFoundException.class, () -> ribbon.showContextCategory(other));
    }

    @Test
    void collapseButtonTogglesCategories() {
        ribbon.addCategory("Home");
        events.clear();
        ribbon.collapseButton().doClick(0);
        assertTrue(ribbon.isCollapsed());
        assertEquals("Expand Ribbon", ribbon.collapseButton().getToolTipText());
        assertTrue(ribbon.getPreferredSize().height < ribbon.ribbonHeight());
        ribbon.collapseButton().doClick(0);
        assertFalse(ribbon.isCollapsed());
        assertEquals(ribbon.ribbonHeight(), ribbon.getPreferredSize().height);
        assertEquals(List.of(new RibbonEvent(RibbonEvent.Type.COLLAPSED_CHANGED, true),
                new RibbonEvent(RibbonEvent.Type.COLLAPSED_CHANGED, false)), events);
    }

    @Test
    void helpButtonRaisesEvent() {
        ribbon.helpButton().doClick(0);
        assertEquals(List.of(RibbonEvent.Type.HELP_REQUESTED), types());
        ribbon.removeHelpButton();
        assertFalse(ribbon.helpButton().isVisible());
    }

    @Test
    void ribbonHeightMustBePositive() {
        ribbon.setRibbonHeight(200);
        assertEquals(200, ribbon.getPreferredSize().height);
        assertThrows(ConfigurationException.class, () -> ribbon.setRibbonHeight(0));
    }

    @Test
    void fileMenuAndExtraButtons() {
        var menu = new JPopupMenu();
        ribbon.setFileMenu(menu);
        ribbon.setFileTitle("Start");
        assertSame(menu, ribbon.fileMenu());
        assertEquals("Start", ribbon.applicationButton().getText());

        var save = new JButton("Save");
        ribbon.addQuickAccessButton(save);
        assertEquals(List.of(save), ribbon.quickAccessButtons());

        var account = new JButton("Account");
        ribbon.addRightButton(account);
        assertEquals(List.of(account, ribbon.collapseButton(), ribbon.helpButton()), ribbon.rightButtons());
    }

    @Test
    void currentCategoryTurnedContextualHandsOverSelection() {
        var home = ribbon.addCategory("Home");
        var insert = ribbon.addCategory("Insert");
        home.setCategoryStyle(Category.Style.CONTEXTUAL);
        assertFalse(home.isShown());
        assertSame(insert, ribbon.currentCategory());
        assertEquals(List.of(insert), ribbon.visibleCategories());
        assertEquals(0, ribbon.currentIndex());
        assertNull(ribbon.tabButton(home).getParent());

        home.showContextCategory();
        assertSame(home, ribbon.currentCategory());
        home.setCategoryStyle(Category.Style.NORMAL);
        assertTrue(home.isShown());
        assertSame(home, ribbon.currentCategory());
    }

    @Test
    void onlyCategoryTurnedContextualLeavesNothingCurrent() {
        var home = ribbon.addCategory("Home");
        home.setCategoryStyle(Category.Style.CONTEXTUAL);
        assertNull(ribbon.currentCategory());
        assertEquals(-1, ribbon.currentIndex());
        assertTrue(ribbon.visibleCategories().isEmpty());

        home.setCategoryStyle(Category.Style.NORMAL);
        assertSame(home, ribbon.currentCategory());
    }

    @Test
    void colorChangeRetintsTab() {
        ribbon.addCategory("Home");
        var table = ribbon.addContextCategory("Table");
        table.setColor(Color.GREEN);
        assertEquals(Color.GREEN, ribbon.tabButton(table).getBackground());
        assertTrue(ribbon.tabButton(table).isOpaque());
    }
}
