package com.bondtrader.inquiry;

import com.bondtrader.domain.enums.InquiryState;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.event.KeyedService;
import com.bondtrader.exception.InvalidStateTransitionException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the latest state of each client inquiry and notifies listeners on every
 * transition.
 *
 * <p>The first message for an inquiry id is accepted in any state. After that only the
 * transitions allowed by {@link InquiryState#canTransitionTo} are accepted; re-sending
 * the current state is treated as a refresh. Inquiries are never deleted.
 */
public class InquiryService extends KeyedService<String, Inquiry> {

    private static final Logger log = LoggerFactory.getLogger(InquiryService.class);

    @Override
    public String getName() {
        return "InquiryService";
    }

    /**
     * @throws InvalidStateTransitionException if the inquiry is known and the new state
     *     is not reachable from its current one
     */
    public void onMessage(Inquiry inquiry) {
        findData(inquiry.getInquiryId()).ifPresent(current -> {
            InquiryState from = current.getState();
            InquiryState to = inquiry.getState();
            if (from != to && !from.canTransitionTo(to)) {
                throw new InvalidStateTransitionException(inquiry.getInquiryId(), from, to);
            }
        });

        put(inquiry.getInquiryId(), inquiry.copy());
        log.debug("Inquiry {} -> {} (price {})", inquiry.getInquiryId(), inquiry.getState(), inquiry.getPrice());
        notifyListeners(inquiry.copy());
    }

    /** Moves a RECEIVED inquiry to QUOTED at {@code price}. */
    public void sendQuote(String inquiryId, BigDecimal price) {
        Inquiry quoted = getData(inquiryId).copy();
        quoted.setPrice(price);
        quoted.setState(InquiryState.QUOTED);
        onMessage(quoted);
    }

    /** Moves a RECEIVED inquiry to REJECTED. */
    public void rejectInquiry(String inquiryId) {
        Inquiry rejected = getData(inquiryId).copy();
        rejected.setState(InquiryState.REJECTED);
        onMessage(rejected);
    }
}
