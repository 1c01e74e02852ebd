package io.github.goodees.choreo.store;

/*-
 * #%L
 * choreo
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.EventType;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of events with Jackson. Event types are stored beside the payload, and are resolved to classes
 * through registered event interfaces. Registered classes need to be deserializable by Jackson on their own, e. g.
 * by {@code @JsonDeserialize(as = ...)}.
 * @param <E> base type of events
 */
public class JacksonEventSerialization<E extends Event> implements Serialization<E> {
    private final Class<E> baseType;
    private final ObjectMapper mapper;
    private final Map<String, Class<? extends E>> types = new ConcurrentHashMap<>();

    public JacksonEventSerialization(Class<E> baseType) {
        this(baseType, createMapper());
    }

    public JacksonEventSerialization(Class<E> baseType, ObjectMapper mapper) {
        this.baseType = baseType;
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Register event type for deserialization under its {@linkplain EventType#defaultTypeName(Class) default name}.
     * @param eventClass event class
     * @return this
     */
    public JacksonEventSerialization<E> register(Class<? extends E> eventClass) {
        Class<? extends E> previous = types.putIfAbsent(EventType.defaultTypeName(eventClass), eventClass);
        if (previous != null && previous != eventClass) {
            throw new IllegalArgumentException("Type " + EventType.defaultTypeName(eventClass)
                    + " already registered for " + previous.getName());
        }
        return this;
    }

    @Override
    public int payloadVersion(E object) {
        return 1;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String type) {
        Class<? extends E> eventClass = types.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unknown event type " + type);
        }
        try {
            return mapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize event of type " + type + " version "
                    + payloadVersion, e);
        }
    }

    @Override
    public E toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
