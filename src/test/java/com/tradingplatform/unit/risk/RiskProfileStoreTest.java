package com.tradingplatform.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import com.tradingplatform.risk.RiskLimit;
import com.tradingplatform.risk.RiskLimitType;
import com.tradingplatform.risk.RiskProfile;
import com.tradingplatform.risk.RiskProfileStore;
import com.tradingplatform.unit.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RiskProfileStoreTest {

    private MutableClock clock;
    private RiskProfileStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T09:15:00Z");
        store = new RiskProfileStore(clock);
    }

    private static RiskProfile profile(String id, String orderValueLimit) {
        return RiskProfile.builder()
                .id(id)
                .name(id + " profile")
                .limits(Map.of(
                        RiskLimitType.ORDER_VALUE,
                        RiskLimit.builder().value(new BigDecimal(orderValueLimit)).build()))
                .build();
    }

    @Test
    void createStampsVersionAndTimestamps() {
        RiskProfile created = store.create(profile("aggressive", "50000"));

        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(created.getLimit(RiskLimitType.ORDER_VALUE).getType()).isEqualTo(RiskLimitType.ORDER_VALUE);
    }

    @Test
    void duplicateIdRejected() {
        store.create(profile("aggressive", "50000"));

        assertThatThrownBy(() -> store.create(profile("aggressive", "1")))
                .isInstanceOf(OrderExecutionException.class)
                .hasMessage("Risk profile with ID aggressive already exists");
    }

    @Test
    void blankIdRejected() {
        assertThatThrownBy(() -> store.create(profile(" ", "1")))
                .hasMessage("Risk profile ID cannot be empty");
    }

    @Test
    void updateReplacesWholeProfileAndBumpsVersion() {
        RiskProfile created = store.create(profile("aggressive", "50000"));
        clock.advance(Duration.ofMinutes(5));

        RiskProfile updated = store.update(RiskProfile.builder().id("aggressive").name("renamed").build());

        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(updated.getName()).isEqualTo("renamed");
        assertThat(updated.getLimits()).isEmpty();
        assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(updated.getUpdatedAt()).isAfter(created.getUpdatedAt());
    }

    @Test
    void missingProfileIsNotFound() {
        assertThatThrownBy(() -> store.get("ghost"))
                .hasMessage("Risk profile with ID ghost not found")
                .extracting(e -> ((OrderExecutionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> store.update(profile("ghost", "1"))).hasMessage("Risk profile with ID ghost not found");
        assertThatThrownBy(() -> store.delete("ghost")).hasMessage("Risk profile with ID ghost not found");
    }

    @Test
    void limitWithoutValueRejected() {
        RiskProfile invalid = RiskProfile.builder()
                .id("broken")
                .limits(Map.of(RiskLimitType.EXPOSURE, RiskLimit.builder().build()))
                .build();

        assertThatThrownBy(() -> store.create(invalid)).hasMessage("Risk limit EXPOSURE of profile broken has no value");
    }

    @Test
    void listSortedById() {
        store.create(profile("zeta", "1"));
        store.create(profile("alpha", "1"));

        assertThat(store.list()).extracting(RiskProfile::getId).containsExactly("alpha", "zeta");

        store.delete("alpha");
        assertThat(store.list()).extracting(RiskProfile::getId).containsExactly("zeta");
    }
}
