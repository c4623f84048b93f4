package com.team.qametrics.service.health;

import com.team.qametrics.config.TicketHealthConfig;
import com.team.qametrics.model.ticket.TicketStatusCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class TicketStatusResolverTest {

    private final TicketStatusResolver resolver = new TicketStatusResolver(new TicketHealthConfig());

    @ParameterizedTest
    @CsvSource({
            "Closed, CLOSED",
            "moved to LIVE, CLOSED",
            "Completed - Verified, CLOSED",
            "Closed - Duplicate, CLOSED",
            "In Progress, OPEN",
            "QC Testing, OPEN",
            "Reopened, OPEN"
    })
    void resolve_matchesClosedLabelsAsSubstrings(String status, TicketStatusCategory expected) {
        assertThat(resolver.resolve(status)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void resolve_missingStatusIsOpen(String status) {
        assertThat(resolver.resolve(status)).isEqualTo(TicketStatusCategory.OPEN);
        assertThat(resolver.isClosed(status)).isFalse();
    }

    @Test
    void resolve_customLabelsReplaceDefaults() {
        TicketHealthConfig config = new TicketHealthConfig();
        config.setClosedStatusLabels(Arrays.asList(" Done ", null, ""));
        TicketStatusResolver custom = new TicketStatusResolver(config);

        assertThat(custom.isClosed("DONE")).isTrue();
        assertThat(custom.isClosed("Closed")).isFalse();
        assertThat(custom.isClosed("In Progress")).isFalse();
    }
}
