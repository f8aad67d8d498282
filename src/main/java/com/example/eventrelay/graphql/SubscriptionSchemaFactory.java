package com.example.eventrelay.graphql;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.model.EventAction;
import com.example.eventrelay.service.bus.BusMessage;
import com.example.eventrelay.service.bus.EventBus;
import com.example.eventrelay.service.bus.EventStream;
import com.example.eventrelay.service.bus.EventStreamPump;
import graphql.GraphQL;
import graphql.schema.DataFetcher;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.TypeRuntimeWiring;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 构建订阅 schema：每个订阅字段对应一个总线主题，
 * 字段解析结果是一个惰性 {@link Flux}，被订阅时才向总线注册，取消时关闭总线订阅流。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SubscriptionSchemaFactory {

    static final String SCHEMA_LOCATION = "graphql/schema.graphqls";

    private static final List<EntityType> SUBSCRIBABLE = List.of(EntityType.TASK, EntityType.PRODUCT,
            EntityType.POST);

    private final EventBus eventBus;
    private final EventStreamPump pump;

    public GraphQL createGraphQL() {
        TypeDefinitionRegistry registry = new SchemaParser().parse(loadSchema());

        TypeRuntimeWiring.Builder subscription = TypeRuntimeWiring.newTypeWiring("Subscription");
        for (EntityType type : SUBSCRIBABLE) {
            for (EventAction action : type.actions()) {
                subscription.dataFetcher(fieldName(type, action), topicFetcher(type.topic(action)));
            }
        }

        RuntimeWiring wiring = RuntimeWiring.newRuntimeWiring()
                .type(TypeRuntimeWiring.newTypeWiring("Query").dataFetcher("health", env -> "ok"))
                .type(subscription)
                .build();

        GraphQLSchema schema = new SchemaGenerator().makeExecutableSchema(registry, wiring);
        log.info("[GraphQlWs] Subscription schema built from {}", SCHEMA_LOCATION);
        return GraphQL.newGraphQL(schema).build();
    }

    /**
     * 例如 TASK + CREATED → taskCreated
     */
    static String fieldName(EntityType type, EventAction action) {
        String value = action.value();
        return type.singular() + Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private DataFetcher<Publisher<Map<String, Object>>> topicFetcher(String topic) {
        return env -> Flux.create(sink -> {
            EventStream<BusMessage> stream = eventBus.subscribe(List.of(topic));
            sink.onDispose(stream::close);
            pump.drain(stream, message -> {
                DomainEvent event = message.payloadAs(DomainEvent.class);
                if (event != null) {
                    sink.next(event.payload());
                }
            }, sink::complete);
        });
    }

    private String loadSchema() {
        try (InputStream in = new ClassPathResource(SCHEMA_LOCATION).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + SCHEMA_LOCATION, e);
        }
    }
}
