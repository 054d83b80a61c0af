package com.schedulinglinks.aggregator.crawl.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UsStateTest {

    @Test
    void hasFiftySevenJurisdictionsWithUniqueIds() {
        Set<Integer> ids = new HashSet<>();
        for (UsState state : UsState.values()) {
            ids.add(state.id());
        }
        assertThat(UsState.values()).hasSize(57);
        assertThat(ids).hasSize(57);
    }

    @Test
    void lookupIgnoresCaseAndWhitespace() {
        assertThat(UsState.fromCode("ma")).contains(UsState.MA);
        assertThat(UsState.fromCode(" MA ")).contains(UsState.MA);
        assertThat(UsState.MA.id()).isEqualTo(22);
        assertThat(UsState.MA.code()).isEqualTo("MA");
    }

    @Test
    void unknownCodesAreEmpty() {
        assertThat(UsState.fromCode("ZZ")).isEmpty();
        assertThat(UsState.fromCode("")).isEmpty();
        assertThat(UsState.fromCode(null)).isEmpty();
    }
}
