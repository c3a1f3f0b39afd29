package io.trackimport.lambda;

import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;

/**
 * Continues an import by invoking the same function asynchronously with the updated event.
 */
@Slf4j
@RequiredArgsConstructor
public class LambdaSelfInvocationTrigger implements ContinuationTrigger {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final LambdaClient lambdaClient;
    private final String functionName;

    @Override
    public void continueFrom(ImportEvent event, long byteOffset) {
        log.info("Invoking {} to continue processing the file from byte {}", functionName, byteOffset);
        String payload;
        try {
            payload = OBJECT_MAPPER.writeValueAsString(event.withByteOffset(byteOffset));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize continuation event", e);
        }

        var response = lambdaClient.invoke(InvokeRequest.builder()
            .functionName(functionName)
            .invocationType(InvocationType.EVENT)
            .payload(SdkBytes.fromUtf8String(payload))
            .build());
        if (response.statusCode() == null || response.statusCode() / 100 != 2) {
            throw new IllegalStateException("Continuation invoke of " + functionName
                + " was not accepted, status " + response.statusCode());
        }
    }
}
