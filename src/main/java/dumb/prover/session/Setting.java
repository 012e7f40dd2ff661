package dumb.prover.session;

import org.jetbrains.annotations.Nullable;

/**
 * The current value of an assistant option or flag, as reported by {@code Test <name>.}.
 */
public record Setting(String name, String value) {

    public static @Nullable Setting parse(String line) {
        var m = Patterns.SETTING_PATTERN.matcher(line.strip());
        return m.matches() ? new Setting(m.group("name"), m.group("value").strip()) : null;
    }

    /**
     * Whether this is a flag that is currently set.
     */
    public boolean isOn() {
        return value.equals("on");
    }

    public boolean isFlag() {
        return value.equals("on") || value.equals("off");
    }
}
