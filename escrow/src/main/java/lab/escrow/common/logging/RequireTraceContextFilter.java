package lab.escrow.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Allows only logs that carry a request correlationId or an escrow transactionId in MDC.
 * Used for the flow file appender so it captures request and lifecycle logs only.
 */
public class RequireTraceContextFilter extends Filter<ILoggingEvent> {

    static final String CORRELATION_ID_KEY = "correlationId";
    static final String TRANSACTION_ID_KEY = "transactionId";

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc == null) {
            return FilterReply.DENY;
        }
        if (mdc.containsKey(CORRELATION_ID_KEY) || mdc.containsKey(TRANSACTION_ID_KEY)) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
