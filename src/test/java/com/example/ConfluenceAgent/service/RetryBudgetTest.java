package com.example.ConfluenceAgent.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBudgetTest {

    @Test
    void singleRetryCanBeConsumedOnce() {
        RetryBudget budget = RetryBudget.singleRetry();

        assertThat(budget.remaining()).isEqualTo(1);
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.tryConsume()).isTrue();
        assertThat(budget.tryConsume()).isFalse();
        assertThat(budget.remaining()).isZero();
        assertThat(budget.isExhausted()).isTrue();
    }
}
