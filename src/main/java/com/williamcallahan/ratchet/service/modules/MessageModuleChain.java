package com.williamcallahan.ratchet.service.modules;

import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed, ordered list of {@link MessageModule}s. A module that throws is logged and skipped; the
 * remaining modules still run and the classification attempt succeeds.
 */
public class MessageModuleChain {
    private static final Logger log = LoggerFactory.getLogger(MessageModuleChain.class);

    private final List<MessageModule> modules;

    public MessageModuleChain(List<MessageModule> modules) {
        this.modules = List.copyOf(modules);
    }

    /**
     * @return number of modules that completed without throwing
     */
    public int dispatch(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes, boolean backfill) {
        int ran = 0;
        for (MessageModule module : modules) {
            if (backfill && !module.enabledForBackfill()) {
                log.debug("[MODULES] Skipping {} for backfilled message {} in {}", module.name(), ts, channelId);
                continue;
            }
            try {
                module.onMessage(channelId, ts, attributes);
                ran++;
            } catch (RuntimeException moduleFailure) {
                log.warn("[MODULES] Module {} failed for message {} in {}", module.name(), ts, channelId, moduleFailure);
            }
        }
        return ran;
    }

    public List<String> moduleNames() {
        return modules.stream().map(MessageModule::name).toList();
    }
}
