package com.alphix.liquidity.controller;

import com.alphix.liquidity.common.errors.CalculationFailedError;
import com.alphix.liquidity.common.errors.NetworkMismatchError;
import com.alphix.liquidity.common.errors.RangeTooNarrowError;
import com.alphix.liquidity.common.errors.StepInProgressError;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.common.errors.WalletRejectedError;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class DomainErrorStatusMapperTest {

    @Test
    void testMapping() {
        assertThat(DomainErrorStatusMapper.map(new ValidationError("bad"))).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(DomainErrorStatusMapper.map(new ValidationError("gone", ValidationError.Type.NOT_FOUND)))
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(DomainErrorStatusMapper.map(new StepInProgressError("busy"))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(DomainErrorStatusMapper.map(new WalletRejectedError("no"))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(DomainErrorStatusMapper.map(new NetworkMismatchError(84532L, 1L)))
            .isEqualTo(HttpStatus.PRECONDITION_FAILED);
        assertThat(DomainErrorStatusMapper.map(new RangeTooNarrowError("narrow", 200)))
            .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(DomainErrorStatusMapper.map(new CalculationFailedError("down"))).isEqualTo(HttpStatus.BAD_GATEWAY);
    }
}
