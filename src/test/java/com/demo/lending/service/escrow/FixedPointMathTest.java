package com.demo.lending.service.escrow;

import com.demo.lending.exception.PolicyViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.demo.lending.service.escrow.FixedPointMath.SCALE;
import static com.demo.lending.service.escrow.FixedPointMath.SECONDS_PER_YEAR;
import static com.demo.lending.service.escrow.FixedPointMath.collateralFor;
import static com.demo.lending.service.escrow.FixedPointMath.interestFor;
import static com.demo.lending.service.escrow.FixedPointMath.proRata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Fixed-point helpers")
class FixedPointMathTest {

    private static final BigInteger LTC = new BigInteger("2500000000000000000000");   // 2500 per unit
    private static final BigInteger RATE = new BigInteger("20000000000000000");       // 2% a year

    @Test
    @DisplayName("collateral for a request is the truncated inverse of the ratio")
    void collateralRoundTrip() {
        BigInteger deposited = SCALE;
        BigInteger amount = deposited.multiply(LTC).divide(SCALE);

        assertThat(amount).isEqualTo(new BigInteger("2500000000000000000000"));
        assertThat(collateralFor(amount, LTC)).isEqualTo(deposited);
    }

    @Test
    void collateralTruncatesTowardZero() {
        assertThat(collateralFor(BigInteger.ONE, new BigInteger("3000000000000000000"))).isZero();
        assertThat(collateralFor(BigInteger.TEN, new BigInteger("3000000000000000000"))).isEqualTo(BigInteger.valueOf(3));
    }

    @Test
    void zeroRatioIsRejected() {
        assertThatThrownBy(() -> collateralFor(SCALE, BigInteger.ZERO))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("policy").isEqualTo(PolicyViolationException.Policy.ZERO_LOAN_TO_COLLATERAL);
    }

    @Test
    @DisplayName("a full year at 2% on 2500 units accrues 50 units")
    void yearOfInterest() {
        assertThat(interestFor(LTC, RATE, SECONDS_PER_YEAR))
                .isEqualTo(new BigInteger("50000000000000000000"));
    }

    @Test
    @DisplayName("rate is scaled to the period before it touches the amount")
    void periodRateIsTruncatedFirst() {
        BigInteger huge = SCALE.multiply(SCALE).multiply(SCALE);
        // rate * duration < one year: the period rate truncates to zero whatever the amount
        assertThat(interestFor(huge, BigInteger.ONE, 1)).isZero();
        // amount * rate * duration / year / scale would have been non-zero
        assertThat(huge.multiply(BigInteger.ONE).divide(BigInteger.valueOf(SECONDS_PER_YEAR)).divide(SCALE)).isPositive();
    }

    @Test
    void interestIsDeterministic() {
        BigInteger first = interestFor(new BigInteger("1234567890123456789012"), RATE, 121 * 86400L);
        BigInteger second = interestFor(new BigInteger("1234567890123456789012"), RATE, 121 * 86400L);
        assertThat(first).isEqualTo(second);
    }

    @Test
    void proRataReleasesEverythingOnFullRepayment() {
        assertThat(proRata(SCALE, BigInteger.ZERO, BigInteger.ZERO)).isEqualTo(SCALE);
        assertThat(proRata(BigInteger.valueOf(7), BigInteger.valueOf(3), BigInteger.valueOf(3))).isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    void proRataTruncates() {
        assertThat(proRata(BigInteger.valueOf(100), BigInteger.valueOf(1), BigInteger.valueOf(3))).isEqualTo(BigInteger.valueOf(33));
        assertThat(proRata(SCALE, BigInteger.valueOf(50), BigInteger.valueOf(100))).isEqualTo(SCALE.divide(BigInteger.TWO));
    }
}
