package org.strata.naming;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultNamingTest {

    private DefaultNaming naming;

    @BeforeEach
    void setUp() {
        naming = new DefaultNaming(128);
    }

    @Nested
    @DisplayName("Unique constraint name")
    class UniqueNameTests {

        @Test
        @DisplayName("Format: uq_<table>__<cols>")
        void basicFormat() {
            assertEquals("uq_subject__email", naming.uqName("subject", List.of("email")));
        }

        @Test
        @DisplayName("Columns are lower-cased and sorted")
        void columnsSorted() {
            assertEquals("uq_consent__locale_subject",
                    naming.uqName("Consent", List.of("Subject", "locale")));
        }

        @Test
        @DisplayName("Characters outside [A-Za-z0-9_] are replaced")
        void specialCharacters() {
            assertEquals("uq_order_line__e_mail", naming.uqName("Order Line", List.of("e-mail")));
        }

        @Test
        @DisplayName("Empty names become x")
        void emptyNames() {
            assertEquals("uq_x__x", naming.uqName("", List.of("")));
        }
    }

    @Nested
    @DisplayName("Index name")
    class IndexNameTests {

        @Test
        @DisplayName("Format: ix_<table>__<cols>")
        void basicFormat() {
            assertEquals("ix_orders__a_b", naming.ixName("Orders", List.of("b", "A")));
        }

        @Test
        @DisplayName("No columns leaves an empty column part")
        void noColumns() {
            assertEquals("ix_orders__", naming.ixName("orders", List.of()));
        }
    }

    @Nested
    @DisplayName("Length clamping")
    class ClampTests {

        @Test
        @DisplayName("Long names are clamped to maxLength with an 8-hex hash suffix")
        void clampsWithHash() {
            DefaultNaming shortNaming = new DefaultNaming(16);

            String name = shortNaming.uqName("orders", List.of("customer_email"));

            assertEquals(16, name.length());
            assertTrue(name.startsWith("uq_orde_"), name);
            assertTrue(name.matches("uq_orde_[0-9a-f]{8}"), name);
        }

        @Test
        @DisplayName("The hash is stable and differs between inputs")
        void stableHash() {
            DefaultNaming shortNaming = new DefaultNaming(16);

            String first = shortNaming.ixName("orders", List.of("customer_email"));
            String again = shortNaming.ixName("orders", List.of("customer_email"));
            String other = shortNaming.ixName("orders", List.of("customer_phone"));

            assertEquals(first, again);
            assertNotEquals(first, other);
        }

        @Test
        @DisplayName("Names within the limit are untouched")
        void shortNamesUntouched() {
            assertEquals("ix_a__b", new DefaultNaming(16).ixName("a", List.of("b")));
        }

        @Test
        @DisplayName("Default limit is 63")
        void defaultLimit() {
            String name = new DefaultNaming().uqName("t".repeat(80), List.of("c"));
            assertEquals(63, name.length());
        }

        @Test
        @DisplayName("maxLength below 16 is rejected")
        void rejectsTinyLimit() {
            assertThrows(IllegalArgumentException.class, () -> new DefaultNaming(15));
        }
    }
}
