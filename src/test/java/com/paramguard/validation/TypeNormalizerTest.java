package com.paramguard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TypeNormalizerTest {

    @Test
    void testPlain_SingleCandidate() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.plain(String.class), "x");
        assertEquals(List.of(String.class), type.candidates());
        assertFalse(type.list());
        assertFalse(type.optional());
    }

    @Test
    void testPrimitive_IsBoxed() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.plain(int.class), 1);
        assertEquals(List.of(Integer.class), type.candidates());
    }

    @Test
    void testList_ElementCandidates() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.listOf(String.class), List.of("a"));
        assertEquals(List.of(String.class), type.candidates());
        assertTrue(type.list());
    }

    @Test
    void testListOfUnion_AllElementAlternatives() {
        TypeDescriptor declared = TypeDescriptor.listOf(TypeDescriptor.unionOf(Integer.class, String.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of(1, "a"));
        assertEquals(List.of(Integer.class, String.class), type.candidates());
        assertTrue(type.list());
    }

    @Test
    void testOptional_UnwrapsToInnerType() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.optional(Integer.class), "5");
        assertEquals(List.of(Integer.class), type.candidates());
        assertFalse(type.list());
        assertTrue(type.optional());
    }

    @Test
    void testOptionalList_KeepsListShape() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.optional(TypeDescriptor.listOf(String.class)), null);
        assertTrue(type.list());
        assertTrue(type.optional());
    }

    @Test
    void testUnion_CandidatesInDeclarationOrder() {
        ResolvedType type = TypeNormalizer.normalize(TypeDescriptor.unionOf(Integer.class, Double.class), "1.5");
        assertEquals(List.of(Integer.class, Double.class), type.candidates());
        assertFalse(type.list());
    }

    @Test
    void testUnionWithList_ListValueElectsList() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(String.class), TypeDescriptor.plain(Integer.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of("a", "b"));
        assertTrue(type.list());
        assertEquals(List.of(String.class), type.candidates());
    }

    @Test
    void testUnionWithList_ScalarValueUsesPlainMembers() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(String.class), TypeDescriptor.plain(Integer.class));
        ResolvedType type = TypeNormalizer.normalize(declared, "7");
        assertFalse(type.list());
        assertEquals(List.of(Integer.class), type.candidates());
    }

    @Test
    void testUnionWithList_NonMatchingElementsFallBackToPlainMembers() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(Integer.class), TypeDescriptor.plain(String.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of("1", "2"));
        assertFalse(type.list());
        assertEquals(List.of(String.class), type.candidates());
    }

    @Test
    void testUnionWithList_IntegerElementsElectLongList() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(Long.class), TypeDescriptor.plain(Long.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of(1, 2));
        assertTrue(type.list());
        assertEquals(List.of(Long.class), type.candidates());
    }

    @Test
    void testUnionWithList_LossyElementsDoNotElect() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(Long.class), TypeDescriptor.plain(String.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of(1, 2.5));
        assertFalse(type.list());
    }

    @Test
    void testUnionWithTwoLists_FirstMatchingWins() {
        TypeDescriptor declared = TypeDescriptor.unionOf(TypeDescriptor.listOf(Integer.class), TypeDescriptor.listOf(String.class));
        ResolvedType type = TypeNormalizer.normalize(declared, List.of("x"));
        assertTrue(type.list());
        assertEquals(List.of(String.class), type.candidates());
    }

    @Test
    void testIsOptional() {
        assertTrue(TypeNormalizer.isOptional(TypeDescriptor.optional(String.class)));
        assertTrue(TypeNormalizer.isOptional(TypeDescriptor.unionOf(TypeDescriptor.plain(Integer.class), TypeDescriptor.NULL)));
        assertFalse(TypeNormalizer.isOptional(TypeDescriptor.plain(String.class)));
        assertFalse(TypeNormalizer.isOptional(TypeDescriptor.ANY));
    }

    @Test
    void testAny_CannotBeNormalised() {
        assertThrows(IllegalArgumentException.class, () -> TypeNormalizer.normalize(TypeDescriptor.ANY, "x"));
    }
}
