package com.yamdb.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yamdb.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AccountRulesTest {

    @ParameterizedTest
    @ValueSource(strings = {"alice", "a.b@c+d-e_f", "Юзер42"})
    void acceptsUsernamesFromAllowedAlphabet(String username) {
        assertThat(AccountRules.requireValidUsername(username)).isEqualTo(username);
    }

    @Test
    void rejectsReservedAndMalformedUsernames() {
        assertThatThrownBy(() -> AccountRules.requireValidUsername("me"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("auth.username_reserved"));
        assertThatThrownBy(() -> AccountRules.requireValidUsername("bad name!"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("auth.username_invalid"));
        assertThatThrownBy(() -> AccountRules.requireValidUsername("x".repeat(151)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("auth.username_too_long"));
    }

    @Test
    void normalizesEmail() {
        assertThat(AccountRules.requireValidEmail("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThatThrownBy(() -> AccountRules.requireValidEmail("not-an-email"))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void blankOptionalNameBecomesNull() {
        assertThat(AccountRules.optionalName("first_name", "   ")).isNull();
        assertThat(AccountRules.optionalName("first_name", " Ann ")).isEqualTo("Ann");
    }
}
