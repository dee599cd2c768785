package com.example.slidetranslate.service.ai;

import com.example.slidetranslate.dto.translation.BatchItem;
import com.example.slidetranslate.dto.translation.BatchResult;
import com.example.slidetranslate.dto.translation.StyledRun;
import com.example.slidetranslate.service.markup.StyleMarkupCodec;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MockChatClientTest {

    @Test
    void echoesEveryLineWithMarker() {
        MockChatClient client = new MockChatClient();
        String payload = BatchProtocol.serialize(Arrays.asList(
            new BatchItem(0, "<b>こんにちは</b>", 10),
            new BatchItem(1, "世界", 4)));

        List<BatchResult> results = BatchProtocol.parse(client.complete("system", payload));

        assertThat(results).containsExactly(
            new BatchResult(0, "[MOCK] <b>こんにちは</b>"),
            new BatchResult(1, "[MOCK] 世界"));
    }

    @Test
    void paragraphSeparatorInsideTextDoesNotSplitTheRequestLine() {
        MockChatClient client = new MockChatClient();
        String markup = StyleMarkupCodec.encode(List.of(StyledRun.plain("first\u2028second")));
        String payload = BatchProtocol.serialize(List.of(new BatchItem(0, markup, 20)));

        List<BatchResult> results = BatchProtocol.parse(client.complete("system", payload));

        assertThat(results).containsExactly(new BatchResult(0, "[MOCK] first<br/>second"));
    }

    @Test
    void skipsMalformedLines() {
        MockChatClient client = new MockChatClient();

        assertThat(client.complete("system", "not a batch line")).isEmpty();
    }
}
