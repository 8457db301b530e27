package com.payroll.payslip;

import com.payroll.calculator.PayrollEngine;
import com.payroll.calculator.RateTable;
import com.payroll.calculator.RateTableLoader;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

public class PayslipApp {

    private static final Logger log = LoggerFactory.getLogger(PayslipApp.class);

    static final String ATTENDANCE_TOPIC = "employee-attendance";
    static final String EMPLOYEE_EVENTS_TOPIC = "employee-events";
    static final String PAYROLL_TOPIC = "employee-payroll";

    public static void main(String[] args) {
        Properties props = buildConfig();
        String appId = props.getProperty(StreamsConfig.APPLICATION_ID_CONFIG);
        String bootstrapServers = props.getProperty(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG);

        RateTable rates = RateTableLoader.fromPathOrStandard(System.getenv("PAYROLL_RATE_TABLE"));
        log.info("Using rate table {}", rates.getVersion());

        // State lives in memory, so every start replays both topics from the earliest offset
        resetConsumerGroup(appId, bootstrapServers);

        Topology topology = buildTopology(new PayslipState(), new PayrollEngine(rates));
        log.info("Topology:\n{}", topology.describe());

        KafkaStreams streams = new KafkaStreams(topology, props);
        streams.cleanUp();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            streams.close();
            latch.countDown();
        }));

        try {
            streams.start();
            log.info("Payslip Processor started");
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void resetConsumerGroup(String appId, String bootstrapServers) {
        Properties adminProps = new Properties();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        try (AdminClient admin = AdminClient.create(adminProps)) {
            // The previous instance's session may not have expired on the broker yet
            for (int attempt = 1; attempt <= 6; attempt++) {
                try {
                    admin.deleteConsumerGroups(Collections.singleton(appId)).all().get();
                    log.info("Deleted consumer group '{}' for full replay", appId);
                    return;
                } catch (Exception e) {
                    String msg = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                    if (msg != null && msg.contains("not empty")) {
                        log.info("Consumer group '{}' still has active members, waiting... (attempt {}/6)", appId, attempt);
                        Thread.sleep(10_000);
                    } else if (msg != null && msg.contains("does not exist")) {
                        log.info("Consumer group '{}' does not exist (first run), proceeding", appId);
                        return;
                    } else {
                        log.warn("Failed to delete consumer group '{}': {}", appId, msg);
                        return;
                    }
                }
            }
            log.warn("Could not delete consumer group '{}' after 6 attempts, proceeding anyway", appId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("AdminClient error: {}", e.getMessage());
        }
    }

    static Topology buildTopology(PayslipState state, PayrollEngine engine) {
        Topology topology = new Topology();

        // Sources
        topology.addSource("attendance-source",
            Serdes.String().deserializer(), Serdes.String().deserializer(),
            ATTENDANCE_TOPIC);

        topology.addSource("employee-events-source",
            Serdes.String().deserializer(), Serdes.String().deserializer(),
            EMPLOYEE_EVENTS_TOPIC);

        // Processors share one state so each sees the other's updates
        topology.addProcessor("attendance-processor",
            () -> new PayslipProcessor(PayslipProcessor.ATTENDANCE_SOURCE, state, engine),
            "attendance-source");

        topology.addProcessor("employee-events-processor",
            () -> new PayslipProcessor(PayslipProcessor.EMPLOYEE_EVENTS_SOURCE, state, engine),
            "employee-events-source");

        // Sink
        topology.addSink("payroll-sink",
            PAYROLL_TOPIC,
            Serdes.String().serializer(), Serdes.String().serializer(),
            "attendance-processor", "employee-events-processor");

        return topology;
    }

    static Properties buildConfig() {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG,
            envOrDefault("APPLICATION_ID", "payslip-processor"));
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG,
            envOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:29092"));
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        // One thread, since both processors share in-memory state
        props.put(StreamsConfig.NUM_STREAM_THREADS_CONFIG, 1);
        props.put(StreamsConfig.COMMIT_INTERVAL_MS_CONFIG, 1000);
        // Start from earliest on fresh start, which rebuilds the in-memory state
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return props;
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
