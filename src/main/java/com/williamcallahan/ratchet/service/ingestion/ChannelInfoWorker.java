package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.chat.ChannelInfo;
import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.jobs.args.ChannelInfoArgs;
import com.williamcallahan.ratchet.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes the stored channel name.
 */
public class ChannelInfoWorker implements JobWorker<ChannelInfoArgs> {
    private static final Logger log = LoggerFactory.getLogger(ChannelInfoWorker.class);

    private final ChatClient chatClient;
    private final MessageStore store;

    public ChannelInfoWorker(ChatClient chatClient, MessageStore store) {
        this.chatClient = chatClient;
        this.store = store;
    }

    @Override
    public String kind() {
        return ChannelInfoArgs.KIND;
    }

    @Override
    public Class<ChannelInfoArgs> argsType() {
        return ChannelInfoArgs.class;
    }

    @Override
    public void work(JobContext context, ChannelInfoArgs args) {
        ChannelInfo info = chatClient.fetchChannelInfo(args.channelId());
        store.updateChannelAttributes(args.channelId(), new ChannelAttributes(null, info.name()));
        log.info("[INGEST] Channel {} is now #{}", args.channelId(), info.name());
    }
}
