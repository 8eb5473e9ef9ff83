package com.bondtrader.inquiry;

import com.bondtrader.domain.enums.InquiryState;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.event.ServiceListener;
import java.math.BigDecimal;

/**
 * Answers every newly received inquiry immediately: quote it at a fixed price, then mark
 * it done. Both steps re-enter the {@link InquiryService} as fresh messages, so every
 * listener on the service sees RECEIVED, QUOTED and DONE in that order, provided this
 * responder is registered after them.
 *
 * <p>There is no client negotiation; REJECTED is never produced on this path.
 */
public class InquiryQuotingResponder implements ServiceListener<Inquiry> {

    private final InquiryService inquiryService;
    private final BigDecimal quotePrice;

    public InquiryQuotingResponder(InquiryService inquiryService, BigDecimal quotePrice) {
        this.inquiryService = inquiryService;
        this.quotePrice = quotePrice;
    }

    @Override
    public void processAdd(Inquiry inquiry) {
        if (inquiry.getState() != InquiryState.RECEIVED) {
            return;
        }
        Inquiry response = inquiry.copy();
        response.setPrice(quotePrice);
        response.setState(InquiryState.QUOTED);
        inquiryService.onMessage(response);

        response.setState(InquiryState.DONE);
        inquiryService.onMessage(response);
    }
}
