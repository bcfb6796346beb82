package com.williamcallahan.ratchet.store;

import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.domain.ChannelRecord;
import com.williamcallahan.ratchet.domain.Incident;
import com.williamcallahan.ratchet.domain.IncidentPriority;
import com.williamcallahan.ratchet.domain.IncidentTag;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.StoredMessage;
import com.williamcallahan.ratchet.domain.ThreadMessageRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for channels, messages, thread replies and incidents.
 *
 * <p>Every method joins the caller's transaction when one is active, so multi-step writes
 * (insert plus enqueue, watermark plus messages) commit or roll back together.</p>
 */
public interface MessageStore {

    /**
     * Registers a channel.
     *
     * @return true when the channel row was created, false when it already existed
     */
    boolean addChannel(String channelId);

    Optional<ChannelRecord> findChannel(String channelId);

    List<ChannelRecord> listChannels();

    /**
     * Overlays non-null attribute fields onto the stored channel attributes.
     *
     * @throws com.williamcallahan.ratchet.domain.errors.UnknownChannelException when the channel is not registered
     */
    ChannelAttributes updateChannelAttributes(String channelId, ChannelAttributes patch);

    void setChannelEnabled(String channelId, boolean enabled);

    /**
     * Reads the channel watermark while holding a row lock until the surrounding transaction ends.
     *
     * @throws com.williamcallahan.ratchet.domain.errors.UnknownChannelException when the channel is not registered
     */
    Optional<SlackTimestamp> lockWatermark(String channelId);

    void writeWatermark(String channelId, SlackTimestamp watermark);

    /**
     * Inserts a top-level message unless one with the same key exists.
     *
     * @return true when a new row was written
     * @throws com.williamcallahan.ratchet.domain.errors.UnknownChannelException when the channel is not registered
     */
    boolean insertMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes);

    /**
     * Inserts a thread reply. Replies whose parent is not stored are skipped.
     *
     * @return true when a new row was written
     */
    boolean insertThreadMessage(String channelId, SlackTimestamp parentTs, SlackTimestamp ts, MessageAttributesV1 attributes);

    Optional<StoredMessage> findMessage(String channelId, SlackTimestamp ts);

    List<StoredMessage> listMessages(String channelId);

    List<ThreadMessageRecord> listThreadMessages(String channelId, SlackTimestamp parentTs);

    /**
     * Replaces a message's attribute bag, and its embedding when one is supplied.
     *
     * @throws com.williamcallahan.ratchet.domain.errors.MessageNotFoundException when no such message is stored
     */
    void updateMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes, float[] embedding);

    /**
     * Writes an incident tag onto a stored message.
     *
     * @return false when the message is not stored
     */
    boolean tagMessage(String channelId, SlackTimestamp ts, IncidentTag tag);

    /**
     * Adjusts a reaction count on a stored message or thread reply.
     *
     * @return false when neither is stored
     */
    boolean applyReaction(String channelId, SlackTimestamp ts, String reaction, int delta);

    /**
     * Deletes top-level messages (and, by cascade, their replies) older than the cutoff.
     *
     * @return number of top-level messages removed
     */
    int deleteMessagesBefore(String channelId, SlackTimestamp cutoff);

    /**
     * Inserts an incident keyed by (channel, service, alert, open timestamp).
     *
     * @return the new incident ID, or empty when the key already exists
     */
    Optional<Long> insertIncident(
            String channelId, SlackTimestamp openTs, String service, String alert, IncidentPriority priority);

    Optional<Incident> findIncidentByKey(String channelId, String service, String alert, SlackTimestamp openTs);

    /**
     * Finds the most recently opened, still-open incident for (channel, service, alert) that opened
     * strictly before {@code before}.
     */
    Optional<Incident> findLatestOpenIncidentBefore(String channelId, String service, String alert, Instant before);

    /**
     * Closes an incident that is still open.
     *
     * @return false when the incident was already closed
     */
    boolean closeIncident(long incidentId, SlackTimestamp closeTs, Instant endTimestamp, Duration duration);

    Optional<Incident> findIncident(long incidentId);

    List<Incident> listIncidents(String channelId);
}
