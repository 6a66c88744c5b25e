package com.umlarchitect.core.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Modifier} and {@link ModifierKind}.
 */
class ModifierTest {

    @Test
    void kind_mapsKnownKeywords() {
        assertThat(Modifier.of("public").kind()).isEqualTo(ModifierKind.PUBLIC);
        assertThat(Modifier.of("private").kind()).isEqualTo(ModifierKind.PRIVATE);
        assertThat(Modifier.of("protected").kind()).isEqualTo(ModifierKind.PROTECTED);
        assertThat(Modifier.of("internal").kind()).isEqualTo(ModifierKind.INTERNAL);
        assertThat(Modifier.of("abstract").kind()).isEqualTo(ModifierKind.ABSTRACT);
        assertThat(Modifier.of("static").kind()).isEqualTo(ModifierKind.STATIC);
    }

    @Test
    void kind_withUnknownKeyword_returnsOther() {
        assertThat(Modifier.of("sealed").kind()).isEqualTo(ModifierKind.OTHER);
        assertThat(Modifier.of("Public").kind()).isEqualTo(ModifierKind.OTHER);
    }

    @Test
    void constructor_withNullKeyword_usesEmptyText() {
        assertThat(Modifier.of(null).keyword()).isEmpty();
    }

    @Test
    void isVisibility_onlyForAccessKeywords() {
        assertThat(ModifierKind.PUBLIC.isVisibility()).isTrue();
        assertThat(ModifierKind.PRIVATE.isVisibility()).isTrue();
        assertThat(ModifierKind.PROTECTED.isVisibility()).isTrue();
        assertThat(ModifierKind.INTERNAL.isVisibility()).isTrue();
        assertThat(ModifierKind.STATIC.isVisibility()).isFalse();
        assertThat(ModifierKind.OTHER.isVisibility()).isFalse();
    }

    @Test
    void contains_findsModifierByKind() {
        List<Modifier> modifiers = Modifier.listOf("public", "abstract");

        assertThat(Modifier.contains(modifiers, ModifierKind.ABSTRACT)).isTrue();
        assertThat(Modifier.contains(modifiers, ModifierKind.STATIC)).isFalse();
    }
}
