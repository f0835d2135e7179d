package com.paramguard.validation.source;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.paramguard.validation.error.ConstraintViolationException;

class ConstraintsTest {

    private static String reason(final Constraints constraints, final Object value) {
        return assertThrows(ConstraintViolationException.class, () -> constraints.check(value)).getMessage();
    }

    @Test
    void testNone_AcceptsAnything() throws Exception {
        assertTrue(Constraints.none().isEmpty());
        Constraints.none().check("x");
        Constraints.none().check(List.of(1, 2));
    }

    @Test
    void testStringLength() {
        Constraints c = Constraints.builder().minStrLength(2).maxStrLength(4).build();
        assertFalse(c.isEmpty());
        assertEquals("must have at least 2 characters", reason(c, "a"));
        assertEquals("must have at most 4 characters", reason(c, "abcde"));
        assertDoesNotThrow(() -> c.check("abc"));
    }

    @Test
    void testWhitelistAndBlacklist() {
        Constraints allowed = Constraints.builder().whitelist("abc").build();
        assertEquals("must contain only characters from 'abc'", reason(allowed, "abd"));
        assertDoesNotThrow(() -> allowed.check("cab"));

        Constraints forbidden = Constraints.builder().blacklist("<>").build();
        assertEquals("must not contain any of '<>'", reason(forbidden, "a<b"));
    }

    @Test
    void testPattern_MustMatchEntirely() {
        Constraints c = Constraints.builder().pattern("[a-z]+").build();
        assertEquals("must match pattern '[a-z]+'", reason(c, "abc1"));
        assertDoesNotThrow(() -> c.check("abc"));
    }

    @Test
    void testNumericBounds() {
        Constraints c = Constraints.builder().minValue(18).maxValue(99).build();
        assertEquals("must be at least 18", reason(c, 15));
        assertEquals("must be at most 99", reason(c, 100L));
        assertEquals("must be at least 18", reason(c, 17.5));
        assertDoesNotThrow(() -> c.check(new BigDecimal("18.0")));
    }

    @Test
    void testListLength_BeforeElements() {
        Constraints c = Constraints.builder().minListLength(2).maxListLength(3).minStrLength(2).build();
        assertEquals("must have at least 2 items", reason(c, List.of("abc")));
        assertEquals("must have at most 3 items", reason(c, List.of("ab", "ab", "ab", "ab")));
        assertEquals("must have at least 2 characters", reason(c, List.of("ab", "a")));
    }

    @Test
    void testFileRules() {
        UploadedFile png = new UploadedFile("f", "a.png", "image/png", new byte[10]);
        Constraints types = Constraints.builder().contentTypes(Set.of("image/png", "image/jpeg")).build();
        assertDoesNotThrow(() -> types.check(png));
        assertEquals("must have a content type in [image/jpeg, image/png]",
            reason(types, new UploadedFile("f", "a.txt", "text/plain", new byte[1])));

        Constraints size = Constraints.builder().minBytes(1).maxBytes(5).build();
        assertEquals("must be at most 5 bytes", reason(size, png));
        assertEquals("must be at least 1 bytes", reason(size, new UploadedFile("f", "e", null, new byte[0])));
    }

    @Test
    void testCustomCheck() {
        Constraints c = Constraints.builder().check(v -> !"root".equals(v)).build();
        assertEquals("failed custom validation", reason(c, "root"));
        assertDoesNotThrow(() -> c.check("ada"));
    }

    @Test
    void testRulesIgnoreOtherKinds() {
        Constraints c = Constraints.builder().minStrLength(10).minValue(100).build();
        assertDoesNotThrow(() -> c.check(Boolean.TRUE));
    }
}
