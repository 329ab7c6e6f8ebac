package com.tony.gridironStats.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeFractionTest {

    @Test
    @DisplayName("parse : séparateur '/' ou '-'")
    void parse_ShouldAcceptSlashAndDash() {
        assertThat(CompositeFraction.parse("23/35")).isEqualTo(new CompositeFraction(23, 35));
        assertThat(CompositeFraction.parse("12-18")).isEqualTo(new CompositeFraction(12, 18));
        assertThat(CompositeFraction.parse(" 4 / 6 ")).isEqualTo(new CompositeFraction(4, 6));
    }

    @Test
    @DisplayName("parse : un nombre seul n'a pas de côté droit")
    void parse_ShouldKeepBareNumberAsLeftOnly() {
        CompositeFraction f = CompositeFraction.parse("7");
        assertThat(f.left()).isEqualTo(7);
        assertThat(f.hasRight()).isFalse();
        assertThat(f.format()).isEqualTo("7");
    }

    @Test
    void parse_ShouldReturnAbsentForBlank() {
        assertThat(CompositeFraction.parse(null).isAbsent()).isTrue();
        assertThat(CompositeFraction.parse("  ").isAbsent()).isTrue();
        assertThat(CompositeFraction.ABSENT.format()).isNull();
    }

    @Test
    @DisplayName("plus : le côté droit n'apparaît que si l'un des deux l'a")
    void plus_ShouldOnlyCarryRightWhenPresent() {
        assertThat(new CompositeFraction(10, 15).plus(new CompositeFraction(7, null)).format()).isEqualTo("17/15");
        assertThat(new CompositeFraction(7, null).plus(new CompositeFraction(3, null)).format()).isEqualTo("10");
        assertThat(CompositeFraction.ABSENT.plus(new CompositeFraction(5, 8)).format()).isEqualTo("5/8");
    }
}
