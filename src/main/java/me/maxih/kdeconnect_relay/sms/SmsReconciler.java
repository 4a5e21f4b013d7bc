package me.maxih.kdeconnect_relay.sms;

import me.maxih.kdeconnect_relay.api.DeviceId;
import me.maxih.kdeconnect_relay.api.MalformedPayloadException;
import me.maxih.kdeconnect_relay.api.SmsConversation;
import me.maxih.kdeconnect_relay.api.SmsMessage;
import me.maxih.kdeconnect_relay.api.SmsPacketParser;
import me.maxih.kdeconnect_relay.api.SmsProtocolEvent;
import me.maxih.kdeconnect_relay.relay.CommandDispatcher;
import me.maxih.kdeconnect_relay.util.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Conversation list and open-thread messages for the device whose SMS view is open.
 * <p>
 * Conversations are merged last-writer-wins by thread id and kept newest first. Messages
 * of the open thread are de-duplicated by id and kept oldest first. All tables are
 * guarded by one lock; listeners are called after it is released.
 */
public class SmsReconciler {
    private static final Logger logger = LoggerFactory.getLogger(SmsReconciler.class);

    static final String PLACEHOLDER_PREFIX = "sending_";
    static final String NEW_THREAD_PREFIX = "new_";

    private final Object lock = new Object();
    private final CommandDispatcher dispatcher;
    private final Clock clock;
    private final Duration sendReconcileWindow;
    private final List<Consumer<SmsProtocolEvent>> listeners = new CopyOnWriteArrayList<>();

    private DeviceId deviceId;
    private final List<SmsConversation> conversations = new ArrayList<>();
    private final List<SmsMessage> messages = new ArrayList<>();
    private String selectedThread;
    private ContactDirectory contacts = ContactDirectory.empty();
    private long placeholderSequence;

    public SmsReconciler(CommandDispatcher dispatcher, Clock clock, Duration sendReconcileWindow) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.sendReconcileWindow = sendReconcileWindow;
    }

    public void addListener(Consumer<SmsProtocolEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<SmsProtocolEvent> listener) {
        listeners.remove(listener);
    }

    /**
     * Binds the engine to a device and asks it for its conversation list. Switching to a
     * different device discards everything known about the previous one.
     */
    public void open(DeviceId device) {
        synchronized (lock) {
            if (!device.equals(deviceId)) {
                conversations.clear();
                messages.clear();
                selectedThread = null;
                deviceId = device;
                logger.info("SMS view opened for {}", device);
            }
        }
        dispatcher.requestConversations(device);
    }

    public Optional<DeviceId> deviceId() {
        synchronized (lock) {
            return Optional.ofNullable(deviceId);
        }
    }

    public List<SmsConversation> conversations() {
        synchronized (lock) {
            return List.copyOf(conversations);
        }
    }

    public Optional<SmsConversation> conversation(String threadId) {
        synchronized (lock) {
            return findConversation(threadId);
        }
    }

    public List<SmsMessage> messages() {
        synchronized (lock) {
            return List.copyOf(messages);
        }
    }

    public Optional<String> selectedThread() {
        synchronized (lock) {
            return Optional.ofNullable(selectedThread);
        }
    }

    public ContactDirectory contacts() {
        synchronized (lock) {
            return contacts;
        }
    }

    public void ingestPacket(DeviceId source, String json) {
        synchronized (lock) {
            if (!source.equals(deviceId)) {
                logger.debug("Ignoring SMS packet from {}, open device is {}", source, deviceId);
                return;
            }
        }

        List<SmsMessage> batch;
        try {
            batch = SmsPacketParser.parse(json);
        } catch (MalformedPayloadException e) {
            logger.warn("Dropping malformed SMS packet from {}: {}", source, e.getMessage());
            publish(new SmsProtocolEvent.Error(e.getMessage()));
            return;
        }

        logger.debug("SMS packet from {} with {} messages", source, batch.size());
        for (SmsMessage message : batch) {
            onMessageReceived(message);
        }
        if (!batch.isEmpty()) {
            mergeConversations(toConversations(batch));
        }
    }

    /**
     * Stores the message if it belongs to the open thread and its id is new. An authoritative
     * sent message replaces the optimistic placeholder it echoes.
     *
     * @return whether the open thread's message list changed
     */
    public boolean onMessageReceived(SmsMessage message) {
        boolean stored = false;
        synchronized (lock) {
            if (message.threadId().equals(selectedThread)) {
                stored = storeMessage(message);
            }

            findConversation(message.threadId()).ifPresent(conversation ->
                    replaceConversation(conversation.withLastMessage(message.body(), message.date())));
            conversations.sort(SmsConversation.NEWEST_FIRST);
        }
        publish(new SmsProtocolEvent.MessageReceived(message));
        return stored;
    }

    public void mergeConversations(List<SmsConversation> batch) {
        synchronized (lock) {
            for (SmsConversation incoming : batch) {
                Optional<SmsConversation> existing = findConversation(incoming.threadId());
                if (existing.isPresent()) {
                    replaceConversation(existing.get().mergedWith(incoming));
                } else {
                    conversations.add(incoming);
                }
            }
            conversations.sort(SmsConversation.NEWEST_FIRST);
        }
        publish(new SmsProtocolEvent.ConversationsReceived(batch));
    }

    /**
     * Replaces the contacts and re-resolves every conversation's display name against them.
     *
     * @return number of conversations whose name changed
     */
    public int onContactsLoaded(ContactDirectory directory) {
        int updated = 0;
        synchronized (lock) {
            contacts = directory;
            for (int i = 0; i < conversations.size(); i++) {
                SmsConversation conversation = conversations.get(i);
                Optional<String> name = directory.nameFor(conversation.phoneNumber());
                if (name.isPresent() && !name.get().equals(conversation.contactName())) {
                    conversations.set(i, conversation.withContactName(name.get()));
                    updated++;
                }
            }
        }
        logger.info("Loaded {} contacts, renamed {} conversations", directory.size(), updated);
        return updated;
    }

    public void selectThread(String threadId) {
        DeviceId device;
        synchronized (lock) {
            selectedThread = threadId;
            messages.clear();
            device = deviceId;
        }
        requestThread(device, threadId);
    }

    /**
     * Opens a chat with a contact name or number, reusing a conversation whose number
     * matches or starting a new, not yet persisted one.
     *
     * @return the thread id that is now selected
     */
    public String startChatWith(String input) {
        DeviceId device;
        String threadId;
        boolean existing;
        synchronized (lock) {
            String phoneNumber = contacts.resolveRecipient(input);
            // without digits every digit-less sender would match
            Optional<SmsConversation> match = PhoneNumbers.normalize(phoneNumber).isEmpty()
                    ? Optional.empty()
                    : conversations.stream()
                            .filter(c -> PhoneNumbers.matches(c.phoneNumber(), phoneNumber))
                            .findFirst();

            existing = match.isPresent();
            if (existing) {
                threadId = match.get().threadId();
            } else {
                long now = clock.millis();
                threadId = NEW_THREAD_PREFIX + now;
                String name = contacts.nameFor(phoneNumber).orElse(phoneNumber);
                conversations.add(0, new SmsConversation(threadId, phoneNumber, name, "", now, false));
                conversations.sort(SmsConversation.NEWEST_FIRST);
            }
            selectedThread = threadId;
            messages.clear();
            device = deviceId;
        }

        if (existing) requestThread(device, threadId);
        return threadId;
    }

    /**
     * Sends {@code text} to the open thread. The placeholder shows up in {@link #messages()}
     * right away, before the Core has done anything.
     */
    public Optional<SmsMessage> sendMessage(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        DeviceId device;
        SmsMessage placeholder;
        synchronized (lock) {
            if (deviceId == null || selectedThread == null) {
                logger.warn("No thread selected, message not sent");
                return Optional.empty();
            }
            Optional<SmsConversation> conversation = findConversation(selectedThread);
            if (conversation.isEmpty()) {
                logger.warn("Conversation {} not found, message not sent", selectedThread);
                return Optional.empty();
            }

            long now = clock.millis();
            placeholder = new SmsMessage(PLACEHOLDER_PREFIX + now + "_" + placeholderSequence++,
                    selectedThread, text, conversation.get().phoneNumber(), now, SmsMessage.Direction.SENT, true);
            messages.add(placeholder);
            messages.sort(Comparator.comparingLong(SmsMessage::date));
            device = deviceId;
        }

        logger.info("Sending SMS to {}", placeholder.address());
        dispatcher.sendSms(device, placeholder.address(), text);
        requestThread(device, placeholder.threadId());
        return Optional.of(placeholder);
    }

    public void refreshThread() {
        DeviceId device;
        String threadId;
        synchronized (lock) {
            device = deviceId;
            threadId = selectedThread;
        }
        if (threadId != null) requestThread(device, threadId);
    }

    public void reloadConversations() {
        DeviceId device = deviceId().orElse(null);
        if (device != null) dispatcher.requestConversations(device);
    }

    /** Conversations whose name or last message contains {@code query}, or whose number does. */
    public List<SmsConversation> search(String query) {
        List<SmsConversation> snapshot = conversations();
        if (query == null || query.isEmpty()) return snapshot;

        String lower = query.toLowerCase(Locale.ROOT);
        return snapshot.stream()
                .filter(c -> c.contactName().toLowerCase(Locale.ROOT).contains(lower)
                        || c.phoneNumber().contains(query)
                        || c.lastMessage().toLowerCase(Locale.ROOT).contains(lower))
                .toList();
    }

    private boolean storeMessage(SmsMessage message) {
        for (SmsMessage existing : messages) {
            if (existing.id().equals(message.id())) {
                logger.debug("Message {} already present, skipping", message.id());
                return false;
            }
        }

        if (message.isSent() && !isPlaceholder(message)) {
            findPlaceholderFor(message).ifPresent(placeholder -> {
                messages.remove(placeholder);
                logger.debug("Message {} replaces placeholder {}", message.id(), placeholder.id());
            });
        }

        messages.add(message);
        messages.sort(Comparator.comparingLong(SmsMessage::date));
        return true;
    }

    private Optional<SmsMessage> findPlaceholderFor(SmsMessage sent) {
        long window = sendReconcileWindow.toMillis();
        return messages.stream()
                .filter(SmsReconciler::isPlaceholder)
                .filter(p -> p.threadId().equals(sent.threadId()))
                .filter(p -> p.body().equals(sent.body()))
                .filter(p -> PhoneNumbers.matches(p.address(), sent.address()))
                .filter(p -> Math.abs(p.date() - sent.date()) <= window)
                .min(Comparator.comparingLong(SmsMessage::date));
    }

    static boolean isPlaceholder(SmsMessage message) {
        return message.id().startsWith(PLACEHOLDER_PREFIX);
    }

    private List<SmsConversation> toConversations(List<SmsMessage> batch) {
        Map<String, List<SmsMessage>> byThread = new LinkedHashMap<>();
        for (SmsMessage message : batch) {
            byThread.computeIfAbsent(message.threadId(), k -> new ArrayList<>()).add(message);
        }

        ContactDirectory directory = contacts();
        List<SmsConversation> result = new ArrayList<>(byThread.size());
        for (Map.Entry<String, List<SmsMessage>> entry : byThread.entrySet()) {
            List<SmsMessage> threadMessages = entry.getValue();
            SmsMessage newest = threadMessages.stream().max(Comparator.comparingLong(SmsMessage::date)).orElseThrow();
            boolean unread = threadMessages.stream().anyMatch(m -> !m.read());
            String name = directory.nameFor(newest.address()).orElse(newest.address());
            result.add(new SmsConversation(entry.getKey(), newest.address(), name,
                    newest.body(), newest.date(), unread));
        }
        return result;
    }

    private Optional<SmsConversation> findConversation(String threadId) {
        return conversations.stream().filter(c -> c.threadId().equals(threadId)).findFirst();
    }

    private void replaceConversation(SmsConversation updated) {
        for (int i = 0; i < conversations.size(); i++) {
            if (conversations.get(i).threadId().equals(updated.threadId())) {
                conversations.set(i, updated);
                return;
            }
        }
    }

    private void requestThread(DeviceId device, String threadId) {
        if (device == null) return;
        try {
            dispatcher.requestConversation(device, Long.parseLong(threadId));
        } catch (NumberFormatException e) {
            logger.debug("Thread {} does not exist on the phone yet, not requesting it", threadId);
        }
    }

    private void publish(SmsProtocolEvent event) {
        for (Consumer<SmsProtocolEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("SMS listener failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }
}
