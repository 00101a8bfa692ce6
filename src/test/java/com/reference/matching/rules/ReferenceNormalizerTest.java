package com.reference.matching.rules;

import com.reference.matching.core.model.NormalizedReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceNormalizerTest {

    private final ReferenceNormalizer normalizer = new ReferenceNormalizer();

    @Nested
    @DisplayName("Simple references")
    class SimpleReferences {

        @Test
        @DisplayName("Should strip dots and keep a single part")
        void testDottedReference() {
            NormalizedReference ref = normalizer.normalize("H.085.LR1X");
            assertEquals("H085LR1X", ref.canonical());
            assertEquals(List.of("H085LR1X"), ref.parts());
            assertFalse(ref.isComposite());
            assertTrue(ref.isSearchable());
        }

        @ParameterizedTest
        @DisplayName("Should canonicalize separators and case")
        @CsvSource({
                "P-HF.1595,PHF1595",
                "p-hf 1595,PHF1595",
                "ac05_m8,AC05M8",
                "  12/34  ,1234",
                "K&N-33.2304,KN332304",
                "Ölfilter 123,LFILTER123"
        })
        void testCanonicalization(String raw, String expected) {
            assertEquals(expected, normalizer.normalize(raw).canonical());
        }

        @Test
        @DisplayName("Same input always yields the same output")
        void testDeterminism() {
            assertEquals(normalizer.normalize("P-HF.1595"), normalizer.normalize("P-HF.1595"));
            assertEquals(normalizer.normalize("ABC+DEF"), new ReferenceNormalizer().normalize("ABC+DEF"));
        }

        @ParameterizedTest
        @DisplayName("Canonical form is a fixed point")
        @ValueSource(strings = {"H.085.LR1X", "P-HF.1595", "ABC+DEF", "a b c", "x-1 + y-2 + z-3", "12/34"})
        void testIdempotence(String raw) {
            String canonical = normalizer.normalize(raw).canonical();
            assertEquals(canonical, normalizer.normalize(canonical).canonical());
        }
    }

    @Nested
    @DisplayName("Canonical tokens")
    class CanonicalTokens {

        @Test
        @DisplayName("Null and blank tokens canonicalize to an empty string")
        void testNullAndBlank() {
            assertEquals("", normalizer.canonicalize(null));
            assertEquals("", normalizer.canonicalize(""));
            assertEquals("", normalizer.canonicalize("   "));
        }

        @ParameterizedTest
        @DisplayName("Only upper-case ASCII letters and digits remain")
        @ValueSource(strings = {"h.085.lr1x", "Brembo 07.BB15", "çà-12/ß", "\t+x_y+\n", "€ 365,50"})
        void testCharacterSet(String token) {
            assertTrue(normalizer.canonicalize(token).matches("[A-Z0-9]*"), token);
        }

        @Test
        @DisplayName("Equivalent references share a canonical form")
        void testAreEquivalent() {
            assertTrue(normalizer.areEquivalent("P-HF.1595", "phf 1595"));
            assertFalse(normalizer.areEquivalent("PHF1595", "PHF1596"));
        }
    }

    @Nested
    @DisplayName("Composite references")
    class CompositeReferences {

        @Test
        @DisplayName("Should split on '+' and append each segment after the canonical form")
        void testComposite() {
            NormalizedReference ref = normalizer.normalize("ABC+DEF");
            assertEquals("ABCDEF", ref.canonical());
            assertEquals(List.of("ABCDEF", "ABC", "DEF"), ref.parts());
            assertTrue(ref.isComposite());
            assertEquals(List.of("ABC", "DEF"), ref.segments());
        }

        @Test
        @DisplayName("Should tolerate spaces around the delimiter and normalize each segment")
        void testCompositeWithSpaces() {
            NormalizedReference ref = normalizer.normalize("h-085 + lr.1x + 99");
            assertEquals("H085LR1X99", ref.canonical());
            assertEquals(List.of("H085LR1X99", "H085", "LR1X", "99"), ref.parts());
        }

        @ParameterizedTest
        @DisplayName("A stray delimiter does not make a reference composite")
        @ValueSource(strings = {"ABC+", "+ABC", "ABC++", " + ABC + "})
        void testStrayDelimiter(String raw) {
            NormalizedReference ref = normalizer.normalize(raw);
            assertEquals("ABC", ref.canonical());
            assertFalse(ref.isComposite());
        }
    }

    @Nested
    @DisplayName("Empty input")
    class EmptyInput {

        @ParameterizedTest
        @DisplayName("Should yield an unsearchable reference")
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t", "-._/", "+", "€"})
        void testEmpty(String raw) {
            NormalizedReference ref = normalizer.normalize(raw);
            assertEquals("", ref.canonical());
            assertFalse(ref.isSearchable());
            assertEquals(List.of(""), ref.parts());
        }
    }

    @Nested
    @DisplayName("Code extraction")
    class CodeExtraction {

        @Test
        @DisplayName("Should extract distinct canonical codes in order of appearance")
        void testExtractCodes() {
            List<String> codes = normalizer.extractCodes(
                    "Pastilhas P-HF.1595 para H085LR1X e P-HF.1595.", 4);
            assertEquals(List.of("PASTILHAS", "PHF1595", "PARA", "H085LR1X"), codes);
        }

        @Test
        @DisplayName("Should skip codes shorter than the minimum length")
        void testMinLength() {
            assertEquals(List.of("AB12CD"), normalizer.extractCodes("a ab AB-12-CD", 3));
        }

        @Test
        @DisplayName("Should return an empty list for blank text")
        void testBlank() {
            assertTrue(normalizer.extractCodes(null, 3).isEmpty());
            assertTrue(normalizer.extractCodes("  ", 3).isEmpty());
        }
    }
}
