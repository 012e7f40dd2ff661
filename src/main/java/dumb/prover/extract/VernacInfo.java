package dumb.prover.extract;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * What {@link VernacAnalyzer} recovers from a command's AST.
 *
 * @param vernacType   constructor of the Vernacular expression, e.g. {@code VernacDefinition}
 * @param extendType   for {@code VernacExtend}, the name of the extension
 * @param controlFlags control prefixes such as {@code Time} or {@code Fail}, outermost first
 * @param attributes   attributes in the form {@code name}, {@code name=value} or {@code name (a,b)}
 */
public record VernacInfo(String vernacType, @Nullable String extendType, List<String> controlFlags,
                         List<String> attributes) {

    public VernacInfo {
        controlFlags = List.copyOf(controlFlags);
        attributes = List.copyOf(attributes);
    }

    /**
     * The extension name for plugin commands, otherwise the Vernacular type.
     */
    public String commandType() {
        return extendType != null ? extendType : vernacType;
    }

    public CommandKind kind() {
        return CommandKind.of(commandType());
    }

    public boolean hasAttributeMatching(Pattern p) {
        return attributes.stream().anyMatch(a -> p.matcher(a).find());
    }
}
