package dumb.ribbon;

import org.jetbrains.annotations.Nullable;

import javax.swing.*;
import java.awt.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A strip of mutually exclusive toggle buttons with a popup that shows all of
 * them in a grid. Strip and popup buttons share their models, so selecting in
 * one selects in the other.
 */
public class Gallery extends JPanel {
    private static final int POPUP_COLUMNS = 5;

    private final JPanel strip = new JPanel(new FlowLayout(FlowLayout.LEFT, 2, 2));
    private final JPanel popupGrid = new JPanel(new GridLayout(0, POPUP_COLUMNS, 2, 2));
    private final JPopupMenu popup = new JPopupMenu();
    private final JButton moreButton = new JButton("▾");
    private final ButtonGroup group = new ButtonGroup();
    private final List<JToggleButton> buttons = new ArrayList<>();
    private final List<Consumer<JToggleButton>> selectionListeners = new CopyOnWriteArrayList<>();
    private final boolean popupHideOnClick;
    private final int minimumWidth;

    public Gallery(int minimumWidth, boolean popupHideOnClick) {
        super(new BorderLayout());
        this.popupHideOnClick = popupHideOnClick;
        this.minimumWidth = minimumWidth;

        var scroll = new JScrollPane(strip, ScrollPaneConstants.VERTICAL_SCROLLBAR_NEVER, ScrollPaneConstants.HORIZONTAL_SCROLLBAR_AS_NEEDED);
        scroll.setBorder(BorderFactory.createEmptyBorder());
        add(scroll, BorderLayout.CENTER);

        moreButton.setToolTipText("More");
        moreButton.setMargin(new Insets(0, 2, 0, 2));
        moreButton.addActionListener(e -> showPopup());
        add(moreButton, BorderLayout.EAST);

        popup.add(new JScrollPane(popupGrid));
    }

    public JToggleButton addButton(String text, @Nullable Icon icon, @Nullable String tooltip) {
        var button = new JToggleButton(text, icon);
        if (tooltip != null && !tooltip.isEmpty()) button.setToolTipText(tooltip);
        button.setHorizontalTextPosition(SwingConstants.CENTER);
        button.setVerticalTextPosition(SwingConstants.BOTTOM);
        group.add(button);
        button.addItemListener(e -> {
            if (button.isSelected()) selectionListeners.forEach(l -> l.accept(button));
        });
        strip.add(button);

        var mirror = new JToggleButton(text, icon);
        mirror.setModel(button.getModel());
        mirror.setHorizontalTextPosition(SwingConstants.CENTER);
        mirror.setVerticalTextPosition(SwingConstants.BOTTOM);
        mirror.addActionListener(e -> {
            if (popupHideOnClick) popup.setVisible(false);
        });
        popupGrid.add(mirror);

        buttons.add(button);
        return button;
    }

    public List<JToggleButton> buttons() {
        return Collections.unmodifiableList(buttons);
    }

    public int selectedIndex() {
        for (var i = 0; i < buttons.size(); i++)
            if (buttons.get(i).isSelected()) return i;
        return -1;
    }

    public void setSelectedIndex(int index) {
        if (index < 0 || index >= buttons.size())
            throw new RibbonException.NotFoundException("No gallery button at " + index);
        buttons.get(index).setSelected(true);
    }

    public void addSelectionListener(Consumer<JToggleButton> listener) {
        selectionListeners.add(listener);
    }

    public boolean isPopupHideOnClick() {
        return popupHideOnClick;
    }

    @Override
    public Dimension getPreferredSize() {
        var d = super.getPreferredSize();
        return new Dimension(Math.max(d.width, minimumWidth), d.height);
    }

    @Override
    public Dimension getMinimumSize() {
        var d = super.getMinimumSize();
        return new Dimension(Math.max(d.width, minimumWidth), d.height);
    }

    JPopupMenu popup() {
        return popup;
    }

    private void showPopup() {
        if (isShowing()) popup.show(this, 0, getHeight());
    }
}
