package com.calaccess.filings.service;

import com.calaccess.filings.domain.Form460Submission;
import com.calaccess.filings.domain.item.FilingItem;
import com.calaccess.filings.domain.item.FilingVersionItem;
import com.calaccess.filings.domain.item.ItemizedFields;
import com.calaccess.filings.domain.item.ItemizedLine;
import com.calaccess.filings.domain.item.Schedule;
import com.calaccess.filings.repository.FilingItemRepository;
import com.calaccess.filings.repository.FilingVersionItemRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Current and per-version items of one schedule.
 *
 * <p>The current table is a keyed-overwrite store: the items of a filing are replaced wholesale
 * when a later amendment supersedes it. The version table is append-only. Both reject a second
 * item with the same parent and line item. Transactions are demarcated by the caller.
 *
 * @param <D> schedule-specific payload
 * @param <C> current item entity
 * @param <V> version item entity
 */
public class ScheduleStore<D extends ItemizedFields, C extends FilingItem<D>, V extends FilingVersionItem<D>> {

    private final Schedule<D> schedule;
    private final FilingItemRepository<C> currentRepository;
    private final FilingVersionItemRepository<V> versionRepository;
    private final ItemFactory<Integer, D, C> currentFactory;
    private final ItemFactory<Long, D, V> versionFactory;

    public ScheduleStore(
        Schedule<D> schedule,
        FilingItemRepository<C> currentRepository,
        FilingVersionItemRepository<V> versionRepository,
        ItemFactory<Integer, D, C> currentFactory,
        ItemFactory<Long, D, V> versionFactory
    ) {
        this.schedule = schedule;
        this.currentRepository = currentRepository;
        this.versionRepository = versionRepository;
        this.currentFactory = currentFactory;
        this.versionFactory = versionFactory;
    }

    public Schedule<D> schedule() {
        return schedule;
    }

    /**
     * Attaches one item to a current filing.
     *
     * @throws IllegalArgumentException if {@code fields} belong to another schedule
     */
    public C attachToFiling(Integer filingId, Integer lineItem, ItemizedFields fields) {
        MissingFieldException.require(filingId, "filingId");
        D payload = schedule.payloadOf(fields);
        validate(lineItem, payload);
        if (currentRepository.existsByFilingIdAndLineItem(filingId, lineItem)) {
            throw duplicate("filing " + filingId, lineItem, null);
        }
        return saveUnique(
            () -> currentRepository.saveAndFlush(currentFactory.create(filingId, lineItem, payload)),
            "filing " + filingId,
            lineItem
        );
    }

    public V attachToVersion(Long filingVersionId, Integer lineItem, ItemizedFields fields) {
        MissingFieldException.require(filingVersionId, "filingVersionId");
        D payload = schedule.payloadOf(fields);
        validate(lineItem, payload);
        if (versionRepository.existsByFilingVersionIdAndLineItem(filingVersionId, lineItem)) {
            throw duplicate("filing version " + filingVersionId, lineItem, null);
        }
        return saveUnique(
            () -> versionRepository.saveAndFlush(versionFactory.create(filingVersionId, lineItem, payload)),
            "filing version " + filingVersionId,
            lineItem
        );
    }

    /**
     * Drops the current items of a filing and attaches this schedule's lines of {@code submission}
     * in their place.
     *
     * @return number of items attached
     */
    public int replaceCurrent(Integer filingId, Form460Submission submission) {
        MissingFieldException.require(filingId, "filingId");
        List<ItemizedLine<D>> lines = schedule.linesOf(submission);
        validateLines(lines);
        currentRepository.deleteAllOfFiling(filingId);
        lines.forEach(line -> attachToFiling(filingId, line.lineItem(), line.fields()));
        return lines.size();
    }

    /**
     * Attaches this schedule's lines of {@code submission} to a filing version.
     *
     * @return number of items attached
     */
    public int appendToVersion(Long filingVersionId, Form460Submission submission) {
        List<ItemizedLine<D>> lines = schedule.linesOf(submission);
        lines.forEach(line -> attachToVersion(filingVersionId, line.lineItem(), line.fields()));
        return lines.size();
    }

    /**
     * Checks required fields and line item uniqueness of this schedule's lines without touching
     * storage.
     */
    public void validate(Form460Submission submission) {
        validateLines(schedule.linesOf(submission));
    }

    public Optional<C> findCurrent(Integer filingId, Integer lineItem) {
        return currentRepository.findByFilingIdAndLineItem(filingId, lineItem);
    }

    public List<C> listCurrent(Integer filingId) {
        return currentRepository.findByFilingIdOrderByLineItemAsc(filingId);
    }

    public List<V> listVersion(Long filingVersionId) {
        return versionRepository.findByFilingVersionIdOrderByLineItemAsc(filingVersionId);
    }

    /**
     * Sets the filing reference of the filing's current items to {@code null}.
     */
    public int detachFiling(Integer filingId) {
        return currentRepository.detachFromFiling(filingId);
    }

    /**
     * Sets the version reference of the version's items to {@code null}.
     */
    public int detachVersion(Long filingVersionId) {
        return versionRepository.detachFromVersion(filingVersionId);
    }

    private void validateLines(List<ItemizedLine<D>> lines) {
        Set<Integer> seen = new HashSet<>();
        for (ItemizedLine<D> line : lines) {
            validate(line.lineItem(), line.fields());
            if (!seen.add(line.lineItem())) {
                throw new DuplicateRecordException(schedule + " line item " + line.lineItem() + " appears more than once");
            }
        }
    }

    private void validate(Integer lineItem, D fields) {
        MissingFieldException.require(lineItem, "lineItem");
        if (lineItem < 1) {
            throw new IllegalArgumentException("lineItem must be positive: " + lineItem);
        }
        MissingFieldException.require(fields, "fields");
        MissingFieldException.require(fields.amount(), "amount");
    }

    private <T> T saveUnique(Supplier<T> save, String parent, Integer lineItem) {
        try {
            return save.get();
        } catch (DataIntegrityViolationException ex) {
            throw duplicate(parent, lineItem, ex);
        }
    }

    private DuplicateRecordException duplicate(String parent, Integer lineItem, Throwable cause) {
        String message = schedule + " line item " + lineItem + " already exists on " + parent;
        return cause == null ? new DuplicateRecordException(message) : new DuplicateRecordException(message, cause);
    }
}
