package com.p14n.postrelay.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for the relay. Purely advisory: nothing in the
 * relay reads them back.
 *
 * <ul>
 * <li>relay_broadcasts: broadcasts per channel, with an {@code outcome} of
 * {@code success} or {@code failure}</li>
 * <li>relay_messages_delivered: deliveries handed to local subscribers</li>
 * <li>relay_payload_size: size of delivered payloads</li>
 * <li>relay_active_subscribers / relay_active_channels: registry size</li>
 * <li>relay_reconnects: listener reconnects, by reason</li>
 * </ul>
 */
public class RelayMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");
        private static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");

        private final LongCounter broadcasts;
        private final LongCounter deliveredMessages;
        private final LongHistogram payloadSize;
        private final LongUpDownCounter activeSubscribers;
        private final LongUpDownCounter activeChannels;
        private final LongCounter reconnects;

        public RelayMetrics(Meter meter) {
                broadcasts = meter.counterBuilder("relay_broadcasts")
                                .setDescription("Number of broadcasts attempted")
                                .build();

                deliveredMessages = meter.counterBuilder("relay_messages_delivered")
                                .setDescription("Number of messages handed to local subscribers")
                                .build();

                payloadSize = meter.histogramBuilder("relay_payload_size")
                                .ofLongs()
                                .setDescription("Size of delivered payloads")
                                .setUnit("By")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("relay_active_subscribers")
                                .setDescription("Number of local subscribers")
                                .build();

                activeChannels = meter.upDownCounterBuilder("relay_active_channels")
                                .setDescription("Number of channels with local subscribers")
                                .build();

                reconnects = meter.counterBuilder("relay_reconnects")
                                .setDescription("Number of listener reconnects")
                                .build();
        }

        public void recordBroadcast(String channel, boolean success) {
                broadcasts.add(1, Attributes.of(CHANNEL, channel, OUTCOME, success ? "success" : "failure"));
        }

        /**
         * Records a message handed to the subscribers of a channel.
         *
         * @param channel     the channel
         * @param size        payload size
         * @param subscribers number of subscribers it was handed to
         */
        public void recordDelivered(String channel, long size, int subscribers) {
                Attributes attributes = Attributes.of(CHANNEL, channel);
                deliveredMessages.add(subscribers, attributes);
                payloadSize.record(size, attributes);
        }

        public void recordSubscriberAdded(String channel, boolean newChannel) {
                activeSubscribers.add(1, Attributes.of(CHANNEL, channel));
                if (newChannel) {
                        activeChannels.add(1);
                }
        }

        public void recordSubscriberRemoved(String channel, boolean channelGone) {
                activeSubscribers.add(-1, Attributes.of(CHANNEL, channel));
                if (channelGone) {
                        activeChannels.add(-1);
                }
        }

        public void recordReconnect(String reason) {
                reconnects.add(1, Attributes.of(REASON, reason));
        }
}
