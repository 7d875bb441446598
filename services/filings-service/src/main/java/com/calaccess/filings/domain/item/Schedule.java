package com.calaccess.filings.domain.item;

import com.calaccess.filings.domain.Form460Submission;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * The itemized schedules of Form 460, each typed by the payload its items carry.
 */
public final class Schedule<D extends ItemizedFields> {

    // monetary contributions received
    public static final Schedule<MonetaryContribution> A =
        new Schedule<>("A", MonetaryContribution.class, Form460Submission::scheduleA);
    // nonmonetary contributions received
    public static final Schedule<NonmonetaryContribution> C =
        new Schedule<>("C", NonmonetaryContribution.class, Form460Submission::scheduleC);
    // support and opposition of candidates and measures
    public static final Schedule<ElectionSupportItem> D =
        new Schedule<>("D", ElectionSupportItem.class, Form460Submission::scheduleD);
    // payments made
    public static final Schedule<Payment> E =
        new Schedule<>("E", Payment.class, Form460Submission::scheduleE);
    // sub-itemized payments
    public static final Schedule<PaymentSubItem> E_SUB =
        new Schedule<>("E-SUB", PaymentSubItem.class, Form460Submission::scheduleESub);
    // payments made by agents
    public static final Schedule<AgentPayment> G =
        new Schedule<>("G", AgentPayment.class, Form460Submission::scheduleG);
    // miscellaneous cash increases
    public static final Schedule<MiscCashIncrease> I =
        new Schedule<>("I", MiscCashIncrease.class, Form460Submission::scheduleI);

    private static final List<Schedule<?>> VALUES = List.of(A, C, D, E, E_SUB, G, I);

    private final String code;
    private final Class<D> payloadType;
    private final Function<Form460Submission, List<ItemizedLine<D>>> lines;

    private Schedule(String code, Class<D> payloadType, Function<Form460Submission, List<ItemizedLine<D>>> lines) {
        this.code = code;
        this.payloadType = payloadType;
        this.lines = lines;
    }

    public static List<Schedule<?>> values() {
        return VALUES;
    }

    public static Optional<Schedule<?>> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        return VALUES.stream().filter(s -> s.code.equals(normalized)).findFirst();
    }

    public String code() {
        return code;
    }

    /**
     * Lines of this schedule carried by a submission, never {@code null}.
     */
    public List<ItemizedLine<D>> linesOf(Form460Submission submission) {
        List<ItemizedLine<D>> result = lines.apply(submission);
        return result == null ? List.of() : result;
    }

    /**
     * Narrows item fields to this schedule's payload; {@code null} passes through.
     *
     * @throws IllegalArgumentException if the fields belong to another schedule
     */
    public D payloadOf(ItemizedFields fields) {
        if (fields != null && !payloadType.isInstance(fields)) {
            throw new IllegalArgumentException(
                this + " items carry " + payloadType.getSimpleName() + ", not " + fields.getClass().getSimpleName());
        }
        return payloadType.cast(fields);
    }

    @Override
    public String toString() {
        return "Schedule " + code;
    }
}
