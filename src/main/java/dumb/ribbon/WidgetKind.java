package dumb.ribbon;

import dumb.ribbon.GridAllocator.Mode;
import dumb.ribbon.RibbonException.NotFoundException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.awt.event.ActionListener;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNullElse;

/**
 * Every kind of control {@link Panel#addWidgetsBy} can build, each bound to the
 * panel method that builds it. Arguments are looked up by name; missing ones
 * take the same defaults as the panel methods.
 */
public enum WidgetKind {
    BUTTON((p, a) -> button(p, a, a.style(ButtonStyle.LARGE))),
    SMALL_BUTTON((p, a) -> button(p, a, ButtonStyle.SMALL)),
    MEDIUM_BUTTON((p, a) -> button(p, a, ButtonStyle.MEDIUM)),
    LARGE_BUTTON((p, a) -> button(p, a, ButtonStyle.LARGE)),
    TOGGLE_BUTTON((p, a) -> toggle(p, a, a.style(ButtonStyle.LARGE))),
    SMALL_TOGGLE_BUTTON((p, a) -> toggle(p, a, ButtonStyle.SMALL)),
    MEDIUM_TOGGLE_BUTTON((p, a) -> toggle(p, a, ButtonStyle.MEDIUM)),
    LARGE_TOGGLE_BUTTON((p, a) -> toggle(p, a, ButtonStyle.LARGE)),
    COMBO_BOX((p, a) -> p.addComboBox(a.strings("items"), a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    FONT_COMBO_BOX((p, a) -> p.addFontComboBox(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    LINE_EDIT((p, a) -> p.addLineEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    TEXT_EDIT((p, a) -> p.addTextEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    PLAIN_TEXT_EDIT((p, a) -> p.addPlainTextEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    LABEL((p, a) -> p.addLabel(a.str("text", ""), a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    PROGRESS_BAR((p, a) -> p.addProgressBar(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    SLIDER((p, a) -> p.addSlider(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    SPIN_BOX((p, a) -> p.addSpinBox(a.integer("value", 0), a.integer("minimum", 0), a.integer("maximum", 99),
            a.integer("step", 1), a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    DOUBLE_SPIN_BOX((p, a) -> p.addDoubleSpinBox(a.decimal("value", 0), a.decimal("minimum", 0), a.decimal("maximum", 99.99),
            a.decimal("step", 1), a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    DATE_EDIT((p, a) -> p.addDateEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    TIME_EDIT((p, a) -> p.addTimeEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    DATE_TIME_EDIT((p, a) -> p.addDateTimeEdit(a.rowSpan(p.smallRows()), a.colSpan(1), a.mode())),
    TABLE_WIDGET((p, a) -> p.addTableWidget(a.rowSpan(p.largeRows()), a.colSpan(1), a.mode())),
    TREE_WIDGET((p, a) -> p.addTreeWidget(a.rowSpan(p.largeRows()), a.colSpan(1), a.mode())),
    LIST_WIDGET((p, a) -> p.addListWidget(a.rowSpan(p.largeRows()), a.colSpan(1), a.mode())),
    SEPARATOR((p, a) -> p.addSeparator(a.orientation(), a.integer("width", 6), a.rowSpan(p.largeRows()), a.colSpan(1), a.mode())),
    HORIZONTAL_SEPARATOR((p, a) -> p.addSeparator(SwingConstants.HORIZONTAL, a.integer("width", 6), a.rowSpan(1), a.colSpan(2), a.mode())),
    VERTICAL_SEPARATOR((p, a) -> p.addSeparator(SwingConstants.VERTICAL, a.integer("width", 6), a.rowSpan(p.largeRows()), a.colSpan(1), a.mode())),
    GALLERY((p, a) -> p.addGallery(a.integer("minimumWidth", 800), a.bool("popupHideOnClick", false),
            a.rowSpan(p.largeRows()), a.colSpan(1), a.mode()));

    private static final Logger logger = LoggerFactory.getLogger(WidgetKind.class);

    private final BiFunction<Panel, Args, JComponent> builder;

    WidgetKind(BiFunction<Panel, Args, JComponent> builder) {
        this.builder = builder;
    }

    public JComponent build(Panel panel, Map<String, Object> arguments) {
        return builder.apply(panel, new Args(requireNonNullElse(arguments, Map.of())));
    }

    /** Accepts {@code LargeButton}, {@code large_button}, {@code large-button} and the like. */
    public static WidgetKind fromString(String text) {
        var key = normalize(text);
        return Stream.of(values()).filter(k -> normalize(k.name()).equals(key)).findFirst()
                .orElseThrow(() -> new NotFoundException("No widget kind " + text));
    }

    private static String normalize(String s) {
        return s.replaceAll("[_\\-\\s]", "").toUpperCase();
    }

    private static JButton button(Panel p, Args a, ButtonStyle style) {
        return p.addButton(a.str("text", ""), a.icon(), style, a.bool("showText", true), a.colSpan(1),
                a.slot(), a.shortcut(), a.str("tooltip", null), a.mode(), GridBagConstraints.CENTER);
    }

    private static JToggleButton toggle(Panel p, Args a, ButtonStyle style) {
        return p.addToggleButton(a.str("text", ""), a.icon(), style, a.bool("showText", true), a.colSpan(1),
                a.slot(), a.shortcut(), a.str("tooltip", null), a.mode(), GridBagConstraints.CENTER);
    }

    /** A widget kind with its arguments, one entry of a bulk description. */
    public record Spec(WidgetKind type, Map<String, Object> arguments) {
        public Spec {
            if (type == null) throw new NotFoundException("Widget spec without a type");
            if (arguments == null) arguments = Map.of();
        }

        public Spec(WidgetKind type) {
            this(type, Map.of());
        }
    }

    /** Typed access to loosely typed arguments, as parsed from JSON or written by hand. */
    record Args(Map<String, Object> values) {

        String str(String key, String def) {
            var v = values.get(key);
            return v == null ? def : v.toString();
        }

        int integer(String key, int def) {
            return values.get(key) instanceof Number n ? n.intValue() : def;
        }

        double decimal(String key, double def) {
            return values.get(key) instanceof Number n ? n.doubleValue() : def;
        }

        boolean bool(String key, boolean def) {
            var v = values.get(key);
            if (v instanceof Boolean b) return b;
            return v == null ? def : Boolean.parseBoolean(v.toString());
        }

        int rowSpan(int def) {
            return integer("rowSpan", def);
        }

        int colSpan(int def) {
            return integer("colSpan", def);
        }

        List<String> strings(String key) {
            return values.get(key) instanceof List<?> l ? l.stream().map(String::valueOf).toList() : List.of();
        }

        Mode mode() {
            var v = values.get("mode");
            if (v instanceof Mode m) return m;
            if (v == null) return Mode.COLUMN_WISE;
            var key = normalize(v.toString());
            return Stream.of(Mode.values()).filter(m -> normalize(m.name()).equals(key)).findFirst()
                    .orElseThrow(() -> new NotFoundException("No placement mode " + v));
        }

        ButtonStyle style(ButtonStyle def) {
            var v = values.get("style");
            if (v instanceof ButtonStyle s) return s;
            return v == null ? def : ButtonStyle.fromString(v.toString());
        }

        int orientation() {
            var v = values.get("orientation");
            if (v instanceof Number n) return n.intValue();
            return v != null && "horizontal".equalsIgnoreCase(v.toString()) ? SwingConstants.HORIZONTAL : SwingConstants.VERTICAL;
        }

        @Nullable ActionListener slot() {
            var v = values.get("slot");
            if (v instanceof ActionListener l) return l;
            if (v instanceof Runnable r) return e -> r.run();
            return null;
        }

        @Nullable KeyStroke shortcut() {
            var v = values.get("shortcut");
            if (v instanceof KeyStroke k) return k;
            return v == null ? null : KeyStroke.getKeyStroke(v.toString());
        }

        /** An {@link Icon}, or a classpath resource or file path to load one from. */
        @Nullable Icon icon() {
            var v = values.get("icon");
            if (v instanceof Icon i) return i;
            if (v == null) return null;
            var path = v.toString();
            var url = WidgetKind.class.getResource(path.startsWith("/") ? path : "/" + path);
            if (url != null) return new ImageIcon(url);
            if (Files.isReadable(Path.of(path))) return new ImageIcon(path);
            logger.warn("Icon {} not found", path);
            return null;
        }
    }
}
