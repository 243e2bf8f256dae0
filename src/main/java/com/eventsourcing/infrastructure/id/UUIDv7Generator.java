package com.eventsourcing.infrastructure.id;

import com.eventsourcing.application.port.out.IdGenerator;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered student ids, so that ids sort by registration time.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator = Generators.timeBasedEpochGenerator();

    @Override
    public UUID generate() {
        return generator.generate();
    }
}
