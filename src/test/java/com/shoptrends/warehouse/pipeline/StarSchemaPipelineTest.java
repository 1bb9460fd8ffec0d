package com.shoptrends.warehouse.pipeline;

import com.shoptrends.warehouse.config.ConflictPolicy;
import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.entity.Customer;
import com.shoptrends.warehouse.entity.Item;
import com.shoptrends.warehouse.entity.Purchase;
import com.shoptrends.warehouse.exception.RejectionKind;
import com.shoptrends.warehouse.load.RelationalStore;
import com.shoptrends.warehouse.load.StarTable;
import com.shoptrends.warehouse.repository.CustomerRepository;
import com.shoptrends.warehouse.repository.ItemRepository;
import com.shoptrends.warehouse.repository.PurchaseRepository;
import com.shoptrends.warehouse.source.FlatRecord;
import com.shoptrends.warehouse.transform.RecordRejection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Sort;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.util.List;

import static com.shoptrends.warehouse.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("StarSchemaPipeline Tests")
class StarSchemaPipelineTest {

    @Autowired
    private StarSchemaPipeline pipeline;

    @Autowired
    private LoaderProperties properties;

    @Autowired
    private RelationalStore store;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private PurchaseRepository purchaseRepository;

    @BeforeEach
    void setUp() {
        store.createSchemaIfAbsent();
        purchaseRepository.deleteAllInBatch();
        itemRepository.deleteAllInBatch();
        customerRepository.deleteAllInBatch();
    }

    @AfterEach
    void restoreProperties() {
        properties.setConflictPolicy(ConflictPolicy.LATER_WINS);
    }

    @Test
    @DisplayName("Should load one row per distinct customer and item and one fact per record")
    void shouldLoadStarSchema() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").build(),
            record(1, 5, "Sandals", "Footwear").build(),
            record(2, 9, "Blouse", "Clothing").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getStageReached()).isEqualTo(RunStage.COMPLETED);
        assertThat(report.getTotalInputRecords()).isEqualTo(3);
        assertThat(report.getRejections()).isEmpty();
        assertThat(report.getCommittedCounts()).containsOnly(
            entry(StarTable.CUSTOMER, 2L), entry(StarTable.ITEM, 2L), entry(StarTable.PURCHASE, 3L));
        assertThat(report.getStoreCounts()).isEqualTo(report.getCommittedCounts());

        assertThat(customerRepository.findAll()).extracting(Customer::getCustomerId)
            .containsExactlyInAnyOrder(5, 9);
        assertThat(purchaseRepository.findAll()).extracting(Purchase::getPurchaseTransactionId)
            .containsExactlyInAnyOrder(0, 1, 2);
        assertThat(purchaseRepository.countWithoutCustomer()).isZero();
        assertThat(purchaseRepository.countWithoutItem()).isZero();
    }

    @Test
    @DisplayName("Should reject an invalid fact and leave its item out of the load")
    void shouldRejectInvalidFact() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").build(),
            record(1, 5, "Sandals", "Footwear").purchaseAmount("-5").build(),
            record(2, 9, "Blouse", "Clothing").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getRejections())
            .extracting(RecordRejection::getKind, RecordRejection::getTransactionId)
            .containsExactly(tuple(RejectionKind.VALIDATION_ERROR, "1"));
        assertThat(report.getLoadedFactCount()).isEqualTo(2);
        assertThat(itemRepository.findAll()).extracting(Item::getItemName).containsExactly("Blouse");
        assertThat(customerRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not let a rejected record change the attributes of a loaded customer")
    void shouldKeepAttributesOfAcceptedRecords() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").location("Maine").build(),
            record(1, 5, "Blouse", "Clothing").location("Texas").purchaseAmount("-1").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getRejectedCount()).isEqualTo(1);
        assertThat(report.getConflicts()).isEmpty();
        assertThat(customerRepository.findById(5)).map(Customer::getLocation).contains("Maine");
    }

    @Test
    @DisplayName("Should reject an amount with an extreme exponent and load the other records")
    void shouldRejectExtremeAmount() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").build(),
            record(1, 9, "Sandals", "Footwear").purchaseAmount("1E+2147483647").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getRejections())
            .extracting(RecordRejection::getKind, RecordRejection::getTransactionId)
            .containsExactly(tuple(RejectionKind.VALIDATION_ERROR, "1"));
        assertThat(report.getLoadedFactCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should account for every input record as loaded or rejected")
    void shouldConserveRecords() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 1, "Hat", "Accessories").build(),
            record(1, 2, "Hat", "Accessories").reviewRating("7").build(),
            record(2, 3, "Belt", "Accessories").build(),
            record(2, 4, "Belt", "Accessories").build(),
            record(4, 5, "Scarf", "Accessories").customerId("x").build(),
            record(5, 6, "Socks", "Clothing").discountApplied("perhaps").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getLoadedFactCount() + report.getRejectedCount()).isEqualTo(report.getTotalInputRecords());
        assertThat(report.getLoadedFactCount()).isEqualTo(2);
        assertThat(report.getRejections())
            .extracting(RecordRejection::getKind)
            .containsExactlyInAnyOrder(RejectionKind.VALIDATION_ERROR, RejectionKind.DUPLICATE_FACT_KEY,
                RejectionKind.VALIDATION_ERROR, RejectionKind.VALIDATION_ERROR);
        assertThat(customerRepository.findAll()).extracting(Customer::getCustomerId)
            .containsExactlyInAnyOrder(1, 3);
        assertThat(purchaseRepository.countWithoutCustomer()).isZero();
        assertThat(purchaseRepository.countWithoutItem()).isZero();
    }

    @Test
    @DisplayName("Should leave identical tables after loading the same input twice")
    void shouldBeIdempotent() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").build(),
            record(1, 5, "Sandals", "Footwear").build(),
            record(2, 9, "Blouse", "Clothing").color("Red").build(),
            record(3, 11, "Jeans", "Clothing").build(),
            record(4, 12, "Hat", "Accessories").build());

        // When
        RunReport first = pipeline.run(new ListItemReader<>(records));
        List<Customer> customers = customerRepository.findAll(Sort.by("customerId"));
        List<Item> items = itemRepository.findAll(Sort.by("itemName", "category"));
        List<Purchase> purchases = purchaseRepository.findAll(Sort.by("purchaseTransactionId"));

        RunReport second = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(first.isCompleted()).isTrue();
        assertThat(second.isCompleted()).isTrue();
        assertThat(second.getStoreCounts()).isEqualTo(first.getStoreCounts());
        assertThat(customerRepository.findAll(Sort.by("customerId"))).isEqualTo(customers);
        assertThat(itemRepository.findAll(Sort.by("itemName", "category"))).isEqualTo(items);
        assertThat(purchaseRepository.findAll(Sort.by("purchaseTransactionId"))).isEqualTo(purchases);
        assertThat(items).filteredOn(item -> item.getItemName().equals("Blouse"))
            .extracting(Item::getColor)
            .containsExactly("Red");
    }

    @Test
    @DisplayName("Should fail during extraction and write nothing under the FAIL policy")
    void shouldFailOnConflictUnderFailPolicy() {
        // Given
        properties.setConflictPolicy(ConflictPolicy.FAIL);
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").age("45").build(),
            record(1, 5, "Sandals", "Footwear").age("46").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.getStatus()).isEqualTo(RunStage.FAILED);
        assertThat(report.getStageReached()).isEqualTo(RunStage.EXTRACTING);
        assertThat(report.getFailureType()).isEqualTo("ConsistencyViolationException");
        assertThat(report.getFailureMessage()).contains("customer_id=5");
        assertThat(report.getCommittedCounts()).isEmpty();
        assertThat(customerRepository.count()).isZero();
        assertThat(purchaseRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should report conflicts and keep the later values under LATER_WINS")
    void shouldReportConflictsUnderLaterWins() {
        // Given
        List<FlatRecord> records = List.of(
            record(0, 5, "Blouse", "Clothing").location("Maine").build(),
            record(1, 5, "Sandals", "Footwear").location("Texas").build());

        // When
        RunReport report = pipeline.run(new ListItemReader<>(records));

        // Then
        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getConflicts())
            .extracting(RecordRejection::getNaturalKey)
            .containsExactly("customer_id=5");
        assertThat(report.getRejections()).isEmpty();
        assertThat(customerRepository.findById(5)).map(Customer::getLocation).contains("Texas");
    }

    @Test
    @DisplayName("Should fail the run when the source cannot be read")
    void shouldFailOnSourceError() {
        // Given
        List<FlatRecord> records = List.of(record(0, 5, "Blouse", "Clothing").build());
        ItemReader<FlatRecord> broken = new ItemReader<>() {
            private final ListItemReader<FlatRecord> delegate = new ListItemReader<>(records);

            @Override
            public FlatRecord read() throws Exception {
                FlatRecord next = delegate.read();
                if (next == null) {
                    throw new IOException("connection reset");
                }
                return next;
            }
        };

        // When
        RunReport report = pipeline.run(broken);

        // Then
        assertThat(report.getStatus()).isEqualTo(RunStage.FAILED);
        assertThat(report.getStageReached()).isEqualTo(RunStage.EXTRACTING);
        assertThat(report.getFailureType()).isEqualTo("SourceReadException");
        assertThat(report.getFailureMessage()).contains("connection reset");
        assertThat(report.getTotalInputRecords()).isEqualTo(1);
        assertThat(customerRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should load empty tables for an empty source")
    void shouldHandleEmptySource() {
        RunReport report = pipeline.run(new ListItemReader<>(List.of()));

        assertThat(report.isCompleted()).isTrue();
        assertThat(report.getTotalInputRecords()).isZero();
        assertThat(report.getStoreCounts()).containsOnly(
            entry(StarTable.CUSTOMER, 0L), entry(StarTable.ITEM, 0L), entry(StarTable.PURCHASE, 0L));
    }
}
