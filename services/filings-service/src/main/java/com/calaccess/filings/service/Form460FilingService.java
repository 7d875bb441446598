package com.calaccess.filings.service;

import com.calaccess.filings.domain.Form460FilingEntity;
import com.calaccess.filings.domain.Form460FilingVersionEntity;
import com.calaccess.filings.domain.Form460Submission;
import com.calaccess.filings.domain.Form460Summary;
import com.calaccess.filings.domain.UpsertResult;
import com.calaccess.filings.domain.item.FilingItem;
import com.calaccess.filings.domain.item.FilingVersionItem;
import com.calaccess.filings.domain.item.ItemizedFields;
import com.calaccess.filings.domain.item.Schedule;
import com.calaccess.filings.repository.Form460FilingRepository;
import com.calaccess.filings.repository.Form460FilingVersionRepository;
import jakarta.transaction.Transactional;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Writes and reads Form 460 filings, their versions and their itemized schedules.
 *
 * <p>References between tables are plain id columns. Deleting a filing or a version never
 * cascades: rows that referenced it keep their data and get a {@code null} reference.
 */
@Service
public class Form460FilingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(Form460FilingService.class);

    private static final int MAX_SEARCH_LIMIT = 200;

    private final Form460FilingRepository filingRepository;
    private final Form460FilingVersionRepository versionRepository;
    private final ScheduleRegistry scheduleRegistry;

    public Form460FilingService(
        Form460FilingRepository filingRepository,
        Form460FilingVersionRepository versionRepository,
        ScheduleRegistry scheduleRegistry
    ) {
        this.filingRepository = filingRepository;
        this.versionRepository = versionRepository;
        this.scheduleRegistry = scheduleRegistry;
    }

    /**
     * Records an original filing: the current filing with no amendments and its version 0.
     */
    @Transactional
    public Form460FilingEntity registerFiling(Integer filingId, Form460Summary summary) {
        requireSummary(filingId, summary);
        if (filingRepository.existsById(filingId)) {
            throw new DuplicateRecordException("Filing already exists: " + filingId);
        }
        Form460FilingVersionEntity original = saveVersion(filingId, 0, summary);
        Form460FilingEntity filing = saveUnique(
            () -> filingRepository.saveAndFlush(Form460FilingEntity.of(filingId, 0, summary)),
            "Filing already exists: " + filingId
        );
        LOGGER.debug("Registered filing {} as version {}", filingId, original.getId());
        return filing;
    }

    /**
     * Records one amendment of a filing and brings the current filing up to date when the
     * amendment is the latest one seen.
     */
    @Transactional
    public AmendmentResult registerAmendment(Integer filingId, Integer amendId, Form460Summary summary) {
        requireSummary(filingId, summary);
        MissingFieldException.require(amendId, "amendId");
        if (amendId < 0) {
            throw new IllegalArgumentException("amendId must not be negative: " + amendId);
        }

        Form460FilingVersionEntity version = saveVersion(filingId, amendId, summary);
        UpsertResult result = filingRepository.findById(filingId)
            .map(existing -> {
                if (!existing.isSupersededBy(amendId)) {
                    LOGGER.info("Amendment {} of filing {} is older than amendment {}; current filing kept",
                        amendId, filingId, existing.getAmendmentCount());
                    return UpsertResult.SKIPPED;
                }
                existing.supersede(amendId, summary);
                filingRepository.saveAndFlush(existing);
                return UpsertResult.UPDATED;
            })
            .orElseGet(() -> {
                saveUnique(
                    () -> filingRepository.saveAndFlush(Form460FilingEntity.of(filingId, amendId, summary)),
                    "Filing already exists: " + filingId
                );
                return UpsertResult.INSERTED;
            });
        return new AmendmentResult(version, result);
    }

    /**
     * Records a submitted amendment with all of its itemized lines.
     *
     * <p>Every line is appended to the new version. When the amendment becomes the current filing,
     * the current items of each schedule are replaced by the submitted ones.
     */
    @Transactional
    public UpsertResult ingest(Form460Submission submission) {
        MissingFieldException.require(submission, "submission");
        for (ScheduleStore<?, ?, ?> store : scheduleRegistry.all()) {
            store.validate(submission);
        }

        AmendmentResult amendment = registerAmendment(submission.filingId(), submission.amendId(), submission.summary());
        Long versionId = amendment.version().getId();
        int versionItems = 0;
        int currentItems = 0;
        for (ScheduleStore<?, ?, ?> store : scheduleRegistry.all()) {
            versionItems += store.appendToVersion(versionId, submission);
            if (amendment.result().isInsertOrUpdate()) {
                currentItems += store.replaceCurrent(submission.filingId(), submission);
            }
        }
        LOGGER.debug("Ingested filing {} amendment {}: {} ({} version items, {} current items)",
            submission.filingId(), submission.amendId(), amendment.result(), versionItems, currentItems);
        return amendment.result();
    }

    /**
     * Deletes the current filing. Its versions and current schedule items are kept with their
     * filing reference set to {@code null}.
     */
    @Transactional
    public void deleteFiling(Integer filingId) {
        if (!filingRepository.existsById(filingId)) {
            throw new RecordNotFoundException("Filing not found: " + filingId);
        }
        int versions = versionRepository.detachFromFiling(filingId);
        int items = 0;
        for (ScheduleStore<?, ?, ?> store : scheduleRegistry.all()) {
            items += store.detachFiling(filingId);
        }
        filingRepository.deleteById(filingId);
        LOGGER.info("Deleted filing {}; orphaned {} versions and {} current items", filingId, versions, items);
    }

    /**
     * Deletes one filing version. Its schedule items are kept with their version reference set to
     * {@code null}. The version the current filing was taken from cannot be deleted.
     */
    @Transactional
    public void deleteVersion(Long filingVersionId) {
        Form460FilingVersionEntity version = versionRepository.findById(filingVersionId)
            .orElseThrow(() -> new RecordNotFoundException("Filing version not found: " + filingVersionId));
        Integer filingId = version.getFilingId();
        boolean current = filingId != null && filingRepository.findById(filingId)
            .map(filing -> filing.getAmendmentCount() == version.getAmendId())
            .orElse(false);
        if (current) {
            throw new IllegalArgumentException("Filing version " + filingId + "-" + version.getAmendId()
                + " is the current amendment of its filing and cannot be deleted");
        }
        int items = 0;
        for (ScheduleStore<?, ?, ?> store : scheduleRegistry.all()) {
            items += store.detachVersion(filingVersionId);
        }
        versionRepository.deleteById(filingVersionId);
        LOGGER.info("Deleted filing version {}; orphaned {} items", filingVersionId, items);
    }

    @Transactional
    public <D extends ItemizedFields> FilingItem<?> attachItem(
        Schedule<D> schedule, Integer filingId, Integer lineItem, D fields
    ) {
        return scheduleRegistry.forSchedule(schedule).attachToFiling(filingId, lineItem, fields);
    }

    @Transactional
    public <D extends ItemizedFields> FilingVersionItem<?> attachVersionItem(
        Schedule<D> schedule, Long filingVersionId, Integer lineItem, D fields
    ) {
        return scheduleRegistry.forSchedule(schedule).attachToVersion(filingVersionId, lineItem, fields);
    }

    public Optional<Form460FilingEntity> getFiling(Integer filingId) {
        return filingRepository.findById(filingId);
    }

    public Form460FilingEntity requireFiling(Integer filingId) {
        return getFiling(filingId)
            .orElseThrow(() -> new RecordNotFoundException("Filing not found: " + filingId));
    }

    public List<Form460FilingVersionEntity> listVersions(Integer filingId) {
        return versionRepository.findByFilingIdOrderByAmendIdAsc(filingId);
    }

    public Optional<Form460FilingVersionEntity> getVersion(Integer filingId, Integer amendId) {
        return versionRepository.findByFilingIdAndAmendId(filingId, amendId);
    }

    public Form460FilingVersionEntity requireVersion(Integer filingId, Integer amendId) {
        return getVersion(filingId, amendId)
            .orElseThrow(() -> new RecordNotFoundException("Filing version not found: " + filingId + "-" + amendId));
    }

    public List<Form460FilingEntity> searchFilings(LocalDate from, LocalDate thru, int limit) {
        return filingRepository.search(from, thru, PageRequest.of(0, Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT))));
    }

    public List<? extends FilingItem<?>> listCurrentItems(String scheduleCode, Integer filingId) {
        return scheduleRegistry.forCode(scheduleCode).listCurrent(filingId);
    }

    public Optional<? extends FilingItem<?>> findCurrentItem(String scheduleCode, Integer filingId, Integer lineItem) {
        return scheduleRegistry.forCode(scheduleCode).findCurrent(filingId, lineItem);
    }

    public List<? extends FilingVersionItem<?>> listVersionItems(String scheduleCode, Integer filingId, Integer amendId) {
        ScheduleStore<?, ?, ?> store = scheduleRegistry.forCode(scheduleCode);
        return store.listVersion(requireVersion(filingId, amendId).getId());
    }

    private Form460FilingVersionEntity saveVersion(Integer filingId, Integer amendId, Form460Summary summary) {
        String duplicate = "Filing version already exists: " + filingId + "-" + amendId;
        if (versionRepository.existsByFilingIdAndAmendId(filingId, amendId)) {
            throw new DuplicateRecordException(duplicate);
        }
        return saveUnique(
            () -> versionRepository.saveAndFlush(Form460FilingVersionEntity.of(filingId, amendId, summary)),
            duplicate
        );
    }

    private void requireSummary(Integer filingId, Form460Summary summary) {
        MissingFieldException.require(filingId, "filingId");
        MissingFieldException.require(summary, "summary");
        MissingFieldException.require(summary.fromDate(), "fromDate");
        MissingFieldException.require(summary.thruDate(), "thruDate");
    }

    private <T> T saveUnique(Supplier<T> save, String message) {
        try {
            return save.get();
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateRecordException(message, ex);
        }
    }
}
