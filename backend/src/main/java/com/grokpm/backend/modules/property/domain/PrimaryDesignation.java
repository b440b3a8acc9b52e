package com.grokpm.backend.modules.property.domain;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Keeps at most one item of a sibling list flagged primary.
 */
public final class PrimaryDesignation {

    private PrimaryDesignation() {
    }

    /**
     * Flags {@code chosen} primary and clears the flag on every other sibling.
     */
    public static <E> void designate(List<E> siblings, E chosen, BiConsumer<E, Boolean> setPrimary) {
        for (E sibling : siblings) {
            setPrimary.accept(sibling, sibling == chosen);
        }
    }

    /**
     * Keeps the first primary sibling, or flags the first sibling when none is primary.
     */
    public static <E> void normalize(List<E> siblings, Predicate<E> isPrimary, BiConsumer<E, Boolean> setPrimary) {
        if (siblings.isEmpty()) {
            return;
        }
        E chosen = siblings.stream().filter(isPrimary).findFirst().orElse(siblings.get(0));
        designate(siblings, chosen, setPrimary);
    }

    public static void designateAddress(List<PropertyAddress> siblings, PropertyAddress chosen) {
        designate(siblings, chosen, PropertyAddress::setPrimary);
    }

    public static void normalizeAddresses(List<PropertyAddress> siblings) {
        normalize(siblings, PropertyAddress::isPrimary, PropertyAddress::setPrimary);
    }

    public static void designatePhoto(List<Photo> siblings, Photo chosen) {
        designate(siblings, chosen, Photo::setPrimary);
    }

    public static void normalizePhotos(List<Photo> siblings) {
        normalize(siblings, Photo::isPrimary, Photo::setPrimary);
    }
}
