package com.researchmatch.store;

import com.researchmatch.model.EmbeddingRecord;
import com.researchmatch.model.dto.EmbeddingSummary;
import com.researchmatch.support.TickingClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for InMemoryEmbeddingStore.
 */
class InMemoryEmbeddingStoreTest {

    private InMemoryEmbeddingStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEmbeddingStore(new TickingClock());
    }

    private EmbeddingRecord put(String name, String ownerId, double... vector) {
        return store.put(name, name + " research", vector, ownerId, Map.of("industry", "Energy")).block();
    }

    @Test
    void put_AssignsIdAndTimestamps() {
        EmbeddingRecord record = put("GreenTech Solutions", "user-1", 0.1, 0.2);

        assertThat(record.getId()).isNotNull();
        assertThat(record.getCreatedAt()).isNotNull().isEqualTo(record.getUpdatedAt());
        assertThat(record.getMetadata()).containsEntry("industry", "Energy");
    }

    @Test
    void put_DoesNotDeduplicate() {
        put("TechCorp AI", "user-1", 1, 0);
        put("TechCorp AI", "user-1", 1, 0);

        StepVerifier.create(store.listByOwner("user-1", 10, 1))
                .expectNextMatches(page -> page.getEmbeddings().size() == 2)
                .verifyComplete();
    }

    @Test
    void findById_ReturnsBitIdenticalVector() {
        double[] vector = {0.1, Math.PI, -1.0e-300, Double.MIN_VALUE, 123456.789012345678};
        EmbeddingRecord stored = put("DataFlow Systems", "user-1", vector);

        StepVerifier.create(store.findById(stored.getId()))
                .assertNext(found -> {
                    assertThat(found.getVector()).isNotSameAs(vector);
                    for (int i = 0; i < vector.length; i++) {
                        assertThat(Double.doubleToRawLongBits(found.getVector()[i]))
                                .isEqualTo(Double.doubleToRawLongBits(vector[i]));
                    }
                })
                .verifyComplete();
    }

    @Test
    void update_ReplacesTextAndVectorKeepsOwner() {
        EmbeddingRecord stored = put("TechCorp AI", "user-1", 1, 0);

        StepVerifier.create(store.update(stored.getId(), "new research", new double[]{0, 1}))
                .assertNext(updated -> {
                    assertThat(updated.getSourceText()).isEqualTo("new research");
                    assertThat(updated.getVector()).containsExactly(0.0, 1.0);
                    assertThat(updated.getOwnerId()).isEqualTo("user-1");
                    assertThat(updated.getCreatedAt()).isEqualTo(stored.getCreatedAt());
                    assertThat(updated.getUpdatedAt()).isAfter(stored.getUpdatedAt());
                })
                .verifyComplete();
    }

    @Test
    void update_UnknownId_CompletesEmpty() {
        StepVerifier.create(store.update(UUID.randomUUID(), "text", new double[]{1}))
                .verifyComplete();
    }

    @Test
    void delete_ReportsWhetherRecordExisted() {
        EmbeddingRecord stored = put("TechCorp AI", "user-1", 1, 0);

        StepVerifier.create(store.delete(stored.getId())).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete(stored.getId())).expectNext(false).verifyComplete();
        StepVerifier.create(store.findById(stored.getId())).verifyComplete();
    }

    @Test
    void listByOwner_PagesNewestFirst() {
        for (int i = 1; i <= 5; i++) {
            put("Company " + i, "user-1", 1, i);
        }
        put("Other", "user-2", 1, 1);

        StepVerifier.create(store.listByOwner("user-1", 2, 2))
                .assertNext(page -> {
                    assertThat(page.getEmbeddings()).extracting(EmbeddingSummary::getCompanyName)
                            .containsExactly("Company 3", "Company 2");
                    assertThat(page.getPagination().getTotal()).isEqualTo(5);
                    assertThat(page.getPagination().getPage()).isEqualTo(2);
                    assertThat(page.getPagination().getLimit()).isEqualTo(2);
                    assertThat(page.getPagination().getPages()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void findByNameSubstring_IsCaseInsensitiveAndOptionallyScoped() {
        put("TechCorp AI", "user-1", 1, 0);
        put("FinTech Partners", "user-2", 1, 0);
        put("GreenTech Solutions", "user-2", 1, 0);
        put("DataFlow Systems", "user-1", 1, 0);

        StepVerifier.create(store.findByNameSubstring("TECH", null).map(EmbeddingSummary::getCompanyName))
                .expectNext("GreenTech Solutions", "FinTech Partners", "TechCorp AI")
                .verifyComplete();

        StepVerifier.create(store.findByNameSubstring("tech", "user-1").map(EmbeddingSummary::getCompanyName))
                .expectNext("TechCorp AI")
                .verifyComplete();
    }

    @Test
    void recentByOwner_ReturnsNewestRecords() {
        put("First", "user-1", 1, 0);
        put("Second", "user-1", 1, 0);
        put("Third", "user-1", 1, 0);

        StepVerifier.create(store.recentByOwner("user-1", 2).map(EmbeddingRecord::getCompanyName))
                .expectNext("Third", "Second")
                .verifyComplete();
    }

    @Test
    void scanCandidates_AppliesCapAndExclusion() {
        put("A", "user-1", 1, 0);
        put("B", "user-2", 1, 0);
        put("C", "user-3", 1, 0);
        put("D", "user-1", 1, 0);

        StepVerifier.create(store.scanCandidates("user-1", 10).map(EmbeddingRecord::getCompanyName))
                .expectNext("C", "B")
                .verifyComplete();

        StepVerifier.create(store.scanCandidates(null, 3).map(EmbeddingRecord::getCompanyName))
                .expectNext("D", "C", "B")
                .verifyComplete();
    }
}
