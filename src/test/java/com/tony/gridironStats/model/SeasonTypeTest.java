package com.tony.gridironStats.model;

import com.tony.gridironStats.exception.InvalidCompilationRequestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeasonTypeTest {

    @Test
    void fromCode_ShouldResolveEspnCodes() {
        assertThat(SeasonType.fromCode(1)).isEqualTo(SeasonType.PRESEASON);
        assertThat(SeasonType.fromCode(2)).isEqualTo(SeasonType.REGULAR);
        assertThat(SeasonType.fromCode(3)).isEqualTo(SeasonType.PLAYOFFS);
    }

    @Test
    void fromCode_ShouldRejectUnknownCode() {
        assertThatThrownBy(() -> SeasonType.fromCode(4))
                .isInstanceOf(InvalidCompilationRequestException.class)
                .hasMessageContaining("seasonType");
    }

    @Test
    @DisplayName("checkEndWeek : bornes par type de saison")
    void checkEndWeek_ShouldEnforceBounds() {
        assertThatCode(() -> SeasonType.REGULAR.checkEndWeek(18)).doesNotThrowAnyException();
        assertThatCode(() -> SeasonType.PRESEASON.checkEndWeek(4)).doesNotThrowAnyException();

        assertThatThrownBy(() -> SeasonType.REGULAR.checkEndWeek(19))
                .isInstanceOf(InvalidCompilationRequestException.class)
                .hasMessageContaining("1-18");
        assertThatThrownBy(() -> SeasonType.PRESEASON.checkEndWeek(5))
                .isInstanceOf(InvalidCompilationRequestException.class);
        assertThatThrownBy(() -> SeasonType.PLAYOFFS.checkEndWeek(0))
                .isInstanceOf(InvalidCompilationRequestException.class);
    }
}
