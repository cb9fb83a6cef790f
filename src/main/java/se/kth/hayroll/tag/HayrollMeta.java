package se.kth.hayroll.tag;

import java.nio.file.Path;
import java.util.List;

/**
 * Typed view of the metadata of a seed tag. Anything that is anchored on a tag (the tag itself,
 * a seed, an invocation, a conditional branch) exposes the tag's fields through this interface.
 */
public interface HayrollMeta {

    /** @return The tag this object is anchored on. */
    HayrollTag hayrollTag();

    default SeedType seedType() {
        return SeedType.fromWireName(hayrollTag().requireString("seedType"));
    }

    default boolean isInvocation() {
        return seedType() == SeedType.INVOCATION;
    }

    default boolean isConditional() {
        return seedType() == SeedType.CONDITIONAL;
    }

    default AstKind astKind() {
        return AstKind.fromWireName(hayrollTag().requireString("astKind"));
    }

    default boolean begin() {
        return hayrollTag().requireBoolean("begin");
    }

    default String name() {
        return hayrollTag().requireString("name");
    }

    default List<String> argNames() {
        return hayrollTag().optionalStrings("argNames");
    }

    default boolean isArg() {
        return hayrollTag().optionalBoolean("isArg");
    }

    default boolean isLvalue() {
        return hayrollTag().optionalBoolean("isLvalue");
    }

    /** @return The translator's hint that the macro can be turned into a plain function. */
    default boolean canBeFn() {
        return hayrollTag().optionalBoolean("canBeFn");
    }

    default boolean isPlaceholder() {
        return hayrollTag().optionalBoolean("isPlaceholder");
    }

    default String premise() {
        return hayrollTag().optionalString("premise");
    }

    default List<String> mergedVariants() {
        return hayrollTag().optionalStrings("mergedVariants");
    }

    /** @return Location of the original construct; unique per seed. */
    default String locBegin() {
        return hayrollTag().requireString("locBegin");
    }

    default String locEnd() {
        return hayrollTag().optionalString("locEnd");
    }

    /** @return Location of the macro definition this invocation or argument refers to. */
    default String locRefBegin() {
        return hayrollTag().requireString("locRefBegin");
    }

    default String cuLnColBegin() {
        return hayrollTag().requireString("cuLnColBegin");
    }

    default String cuLnColEnd() {
        return hayrollTag().requireString("cuLnColEnd");
    }

    default Path file() {
        return hayrollTag().getFile();
    }
}
