package dumb.ribbon;

import org.jetbrains.annotations.Nullable;

import javax.swing.*;
import java.awt.*;

/** Size class of a ribbon button: decides its icon size, text placement and row span. */
public enum ButtonStyle {
    SMALL, MEDIUM, LARGE;

    public int rows(Panel panel) {
        return switch (this) {
            case SMALL -> panel.smallRows();
            case MEDIUM -> panel.mediumRows();
            case LARGE -> panel.largeRows();
        };
    }

    public int iconSize(RibbonConfig.PanelSettings cfg) {
        return switch (this) {
            case SMALL -> cfg.smallIconSize;
            case MEDIUM -> cfg.mediumIconSize;
            case LARGE -> cfg.largeIconSize;
        };
    }

    /** Lays out text and icon of {@code button} for this style and scales the icon to fit. */
    public void apply(AbstractButton button, @Nullable Icon icon, boolean showText, RibbonConfig.PanelSettings cfg) {
        if (icon != null) button.setIcon(scale(icon, iconSize(cfg)));
        if (this == SMALL) {
            button.setHorizontalTextPosition(SwingConstants.RIGHT);
            button.setVerticalTextPosition(SwingConstants.CENTER);
        } else {
            button.setHorizontalTextPosition(SwingConstants.CENTER);
            button.setVerticalTextPosition(SwingConstants.BOTTOM);
        }
        if (!showText && button.getIcon() != null) {
            button.setToolTipText(button.getToolTipText() != null ? button.getToolTipText() : button.getText());
            button.setText("");
        }
        button.setMargin(new Insets(2, 5, 2, 5));
        button.setFocusable(false);
    }

    static Icon scale(Icon icon, int size) {
        if (icon instanceof ImageIcon ii && (ii.getIconWidth() != size || ii.getIconHeight() != size) && ii.getImage() != null)
            return new ImageIcon(ii.getImage().getScaledInstance(size, size, Image.SCALE_SMOOTH));
        return icon;
    }

    public static ButtonStyle fromString(String text) {
        for (var s : values())
            if (s.name().equalsIgnoreCase(text)) return s;
        throw new RibbonException.NotFoundException("No button style " + text);
    }
}
