package com.barmm.ledger.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuditQueryTest {

    @Test
    void likePatternEscapesWildcardsAndBackslash() {
        AuditQuery q = AuditQuery.builder().search("  100%_A\\b ").build();

        assertThat(q.searchNeedle()).isEqualTo("100%_a\\b");
        assertThat(q.searchPattern()).isEqualTo("%100\\%\\_a\\\\b%");
    }

    @Test
    void blankSearchHasNoPattern() {
        assertThat(AuditQuery.builder().search("   ").build().searchPattern()).isNull();
        assertThat(AuditQuery.builder().build().searchNeedle()).isNull();
    }

    @Test
    void pagingDefaults() {
        AuditQuery q = AuditQuery.builder().limit(0).offset(-5).build();

        assertThat(q.limit()).isEqualTo(100);
        assertThat(q.offset()).isZero();
    }
}
