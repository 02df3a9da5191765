package com.stablecore.service;

import com.stablecore.market.Action;
import com.stablecore.market.AssetAmount;
import com.stablecore.auth.AuthContext;
import com.stablecore.model.AssetRateSnapshot;
import com.stablecore.repo.AssetRateSnapshotRepo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateSnapshotServiceTest {

    private final ServiceTestSupport t = new ServiceTestSupport();
    private final AssetRateSnapshotRepo repo = mock(AssetRateSnapshotRepo.class);
    private final RateSnapshotService service = new RateSnapshotService(t.market, repo, t.clock);

    @AfterEach
    void tearDown() {
        t.close();
    }

    @Test
    @DisplayName("one snapshot per registered asset, stamped with the current time")
    void snapshotPerAsset() {
        when(repo.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        t.market.execute(AuthContext.of("lender.test"),
                List.of(Action.of(Action.Type.SUPPLY, AssetAmount.of("usdt", new BigInteger("9000000000000"))))).join();

        List<AssetRateSnapshot> rows = service.poll().join();

        assertThat(rows).extracting(AssetRateSnapshot::getAssetId).containsExactly("native", "usdt", "stable");
        assertThat(rows).allSatisfy(r -> assertThat(r.getTs()).isEqualTo(ServiceTestSupport.NOW));
        assertThat(rows.get(1).getSuppliedBalance()).isEqualTo("9000000000000");
        assertThat(rows.get(1).getBorrowApr()).isEqualTo("0.0");
    }

    @Test
    @DisplayName("a storage failure fails the poll")
    void storageFailure() {
        when(repo.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("mongo down"));

        Throwable err = catchThrowable(() -> service.poll().join());

        assertThat(err).hasRootCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
