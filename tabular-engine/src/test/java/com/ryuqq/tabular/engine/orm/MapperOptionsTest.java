package com.ryuqq.tabular.engine.orm;

import com.ryuqq.tabular.engine.audit.AuditOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MapperOptions 유닛 테스트.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class MapperOptionsTest {

    @Test
    void 기본값_확인() {
        // when
        MapperOptions options = new MapperOptions();

        // then
        assertThat(options.enableTransactions()).isTrue();
        assertThat(options.enableLog()).isFalse();
        assertThat(options.updateReadCheck()).isTrue();
        assertThat(options.requireEditSession()).isFalse();
        assertThat(options.audit()).isEqualTo(new AuditOptions(true, 16));
    }

    @Test
    void withAudit_null이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new MapperOptions().withAudit(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
