package cl.camodev.rrbot.serv.impl;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;
import cl.camodev.rrbot.ot.DTOBotEvent;

/**
 * Publish/subscribe channel between the bot and whatever transport relays its events.
 * <p>
 * Every subscriber owns a bounded queue. Publishing never blocks: when a subscriber falls behind, its
 * oldest pending event is dropped.
 */
public class ServEvents {
	public static final int DEFAULT_QUEUE_CAPACITY = 256;

	private static final Logger logger = LoggerFactory.getLogger(ServEvents.class);
	private static final Gson GSON = new GsonBuilder().serializeNulls().create();

	private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

	public Subscription subscribe() {
		return subscribe(DEFAULT_QUEUE_CAPACITY);
	}

	public Subscription subscribe(int capacity) {
		Subscription subscription = new Subscription(this, capacity);
		subscriptions.add(subscription);
		return subscription;
	}

	public void publish(EnumBotEvent type, Map<String, Object> data) {
		publish(new DTOBotEvent(type, data));
	}

	public void publish(DTOBotEvent event) {
		logger.debug("Event {}", event);
		for (Subscription subscription : subscriptions) {
			subscription.offer(event);
		}
	}

	public int getSubscriberCount() {
		return subscriptions.size();
	}

	/**
	 * Serializes an event as {@code {"type": ..., "timestamp": ..., "data": {...}}}.
	 */
	public static String toJson(DTOBotEvent event) {
		JsonObject json = new JsonObject();
		json.addProperty("type", event.getType().getWireName());
		json.addProperty("timestamp", event.getTimestamp().toString());
		json.add("data", GSON.toJsonTree(event.getData()));
		return GSON.toJson(json);
	}

	/**
	 * One subscriber's view of the event stream.
	 */
	public static final class Subscription implements AutoCloseable {
		private final ServEvents owner;
		private final BlockingQueue<DTOBotEvent> queue;
		private final AtomicLong dropped = new AtomicLong();

		private Subscription(ServEvents owner, int capacity) {
			this.owner = owner;
			this.queue = new ArrayBlockingQueue<>(capacity);
		}

		private synchronized void offer(DTOBotEvent event) {
			while (!queue.offer(event)) {
				if (queue.poll() != null) {
					dropped.incrementAndGet();
				}
			}
		}

		/**
		 * @return the next event, or null if none arrived within the timeout
		 */
		public DTOBotEvent poll(Duration timeout) throws InterruptedException {
			return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}

		public DTOBotEvent poll() {
			return queue.poll();
		}

		public int pending() {
			return queue.size();
		}

		public long getDroppedCount() {
			return dropped.get();
		}

		@Override
		public void close() {
			owner.subscriptions.remove(this);
		}
	}
}
