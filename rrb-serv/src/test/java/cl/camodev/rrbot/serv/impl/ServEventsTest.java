package cl.camodev.rrbot.serv.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;
import cl.camodev.rrbot.ot.DTOBotEvent;

class ServEventsTest {

	@Test
	@DisplayName("Every subscriber receives published events in order")
	void fanOut() throws InterruptedException {
		ServEvents events = new ServEvents();
		try (ServEvents.Subscription first = events.subscribe(); ServEvents.Subscription second = events.subscribe()) {
			events.publish(EnumBotEvent.BOT_STARTED, Collections.singletonMap("device_id", "emulator-5554"));
			events.publish(EnumBotEvent.BOT_STOPPED, null);

			assertEquals(EnumBotEvent.BOT_STARTED, first.poll(Duration.ofSeconds(1)).getType());
			assertEquals(EnumBotEvent.BOT_STOPPED, first.poll(Duration.ofSeconds(1)).getType());
			assertEquals(2, second.pending());
		}
		assertEquals(0, events.getSubscriberCount());
	}

	@Test
	@DisplayName("A full queue drops its oldest event")
	void dropsOldest() {
		ServEvents events = new ServEvents();
		try (ServEvents.Subscription subscription = events.subscribe(2)) {
			events.publish(EnumBotEvent.BOT_STARTED, null);
			events.publish(EnumBotEvent.BOT_PAUSED, null);
			events.publish(EnumBotEvent.BOT_RESUMED, null);

			assertEquals(1, subscription.getDroppedCount());
			assertEquals(EnumBotEvent.BOT_PAUSED, subscription.poll().getType());
			assertEquals(EnumBotEvent.BOT_RESUMED, subscription.poll().getType());
			assertNull(subscription.poll());
		}
	}

	@Test
	@DisplayName("Closed subscriptions stop receiving events")
	void closedSubscription() {
		ServEvents events = new ServEvents();
		ServEvents.Subscription subscription = events.subscribe();
		subscription.close();

		events.publish(EnumBotEvent.BOT_STARTED, null);

		assertEquals(0, subscription.pending());
	}

	@Test
	@DisplayName("Events serialize with their wire name")
	void toJson() {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("error", "boom");
		data.put("code", null);
		DTOBotEvent event = new DTOBotEvent(EnumBotEvent.ERROR_OCCURRED, Instant.parse("2024-01-01T00:00:00Z"), data);

		JsonObject json = JsonParser.parseString(ServEvents.toJson(event)).getAsJsonObject();

		assertEquals("error_occurred", json.get("type").getAsString());
		assertEquals("2024-01-01T00:00:00Z", json.get("timestamp").getAsString());
		assertEquals("boom", json.getAsJsonObject("data").get("error").getAsString());
		assertTrue(json.getAsJsonObject("data").get("code").isJsonNull());
	}
}
