package ru.marthastudios.nudgebot.bot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.property.BotProperty;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Last resort for exceptions that escape a turn. Each step is attempted on its own and a failure is only
 * logged, so the error handler never fails the request itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnErrorHandler {
    public static final String TRACE_NAME = "OnTurnError Trace";
    public static final String TRACE_VALUE_TYPE = "https://www.botframework.com/schemas/error";
    public static final String TRACE_LABEL = "TurnError";

    private final BotStateStore botStateStore;
    private final BotProperty botProperty;

    public void onTurnError(TurnContext turnContext, Exception exception) {
        log.error("[OnTurnError] unhandled error : {}", exception.getMessage(), exception);

        try {
            if (botProperty.isVerboseErrors()) {
                turnContext.sendText("Oops, something unexpected happened - " + exception.getMessage()
                        + ". Here's some debug info:");
                turnContext.sendText(getStackTrace(exception));
            } else {
                turnContext.sendText("Oops, something unexpected happened and I hit a problem.");
                turnContext.sendText("Please check the error logged and try again.");
            }
        } catch (Exception sendException) {
            log.error("[OnTurnError] Failed to send error message to user: {}", sendException.getMessage(), sendException);
        }

        try {
            // Drop the conversation state so a bad state can't loop the user into the same error.
            botStateStore.delete(BotStateStore.conversationKey(turnContext.getActivity()));
        } catch (Exception stateException) {
            log.error("Exception caught on attempting to delete conversation state : {}", stateException.getMessage(), stateException);
        }

        try {
            turnContext.sendTrace(TRACE_NAME, exception.getMessage(), TRACE_VALUE_TYPE, TRACE_LABEL);
        } catch (Exception traceException) {
            log.error("[OnTurnError] Failed to send trace activity: {}", traceException.getMessage(), traceException);
        }
    }

    private static String getStackTrace(Exception exception) {
        StringWriter stringWriter = new StringWriter();

        exception.printStackTrace(new PrintWriter(stringWriter));

        return stringWriter.toString();
    }
}
