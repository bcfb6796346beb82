package com.williamcallahan.ratchet.service.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageModuleChainTest {

    private static final SlackTimestamp TS = SlackTimestamp.parse("1.000000");
    private static final MessageAttributesV1 ATTRIBUTES = MessageAttributesV1.of(ChatMessage.of("1.000000", "U1", "x"));

    @Test
    void backfilledMessagesSkipLiveOnlyModules() {
        MessageModule everywhere = module("incident", true);
        MessageModule liveOnly = module("notifier", false);
        MessageModuleChain chain = new MessageModuleChain(List.of(everywhere, liveOnly));

        assertEquals(1, chain.dispatch("C1", TS, ATTRIBUTES, true));

        verify(everywhere).onMessage("C1", TS, ATTRIBUTES);
        verify(liveOnly, never()).onMessage(any(), any(), any());
    }

    @Test
    void liveMessagesReachEveryModuleInOrder() {
        MessageModuleChain chain = new MessageModuleChain(List.of(module("incident", true), module("notifier", false)));

        assertEquals(2, chain.dispatch("C1", TS, ATTRIBUTES, false));
        assertEquals(List.of("incident", "notifier"), chain.moduleNames());
    }

    @Test
    void failingModuleIsSkippedAndLaterModulesStillRun() {
        MessageModule failing = module("incident", true);
        doThrow(new IllegalStateException("store unavailable")).when(failing).onMessage("C1", TS, ATTRIBUTES);
        MessageModule after = module("notifier", true);
        MessageModuleChain chain = new MessageModuleChain(List.of(failing, after));

        assertEquals(1, chain.dispatch("C1", TS, ATTRIBUTES, false));

        verify(after).onMessage("C1", TS, ATTRIBUTES);
    }

    private static MessageModule module(String name, boolean backfill) {
        MessageModule module = mock(MessageModule.class);
        when(module.name()).thenReturn(name);
        when(module.enabledForBackfill()).thenReturn(backfill);
        return module;
    }
}
