package com.gt.recall.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.recall.model.TrainerMode;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class TrainerModeSerializer extends JsonSerializer<TrainerMode> {
    @Override
    public void serialize(TrainerMode trainerMode, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(trainerMode.getTrainerModeId());
    }
}
