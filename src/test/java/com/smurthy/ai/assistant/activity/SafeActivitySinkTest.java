package com.smurthy.ai.assistant.activity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SafeActivitySinkTest {

    @Mock
    private ActivitySink delegate;

    @Test
    @DisplayName("Should forward notifications to the delegate")
    void testForwarding() {
        // Given
        ActivitySink sink = SafeActivitySink.wrap(delegate);

        // When
        sink.log("hello");
        sink.setState(AssistantState.SPEAKING, "Answering");

        // Then
        verify(delegate).log("hello");
        verify(delegate).setState(AssistantState.SPEAKING, "Answering");
    }

    @Test
    @DisplayName("Should swallow delegate failures")
    void testSwallowsFailures() {
        // Given
        doThrow(new IllegalStateException("broken")).when(delegate).log(anyString());
        doThrow(new IllegalStateException("broken")).when(delegate).setState(any(), anyString());
        ActivitySink sink = SafeActivitySink.wrap(delegate);

        // Then
        assertThatCode(() -> {
            sink.log("hello");
            sink.setState(AssistantState.ERROR, "oops");
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should treat a missing sink as a no-op and not wrap twice")
    void testWrapping() {
        ActivitySink none = SafeActivitySink.wrap(null);
        assertThatCode(() -> none.log("ignored")).doesNotThrowAnyException();

        ActivitySink once = SafeActivitySink.wrap(delegate);
        assertThat(SafeActivitySink.wrap(once)).isSameAs(once);
    }
}
