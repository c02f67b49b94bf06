package com.gt.recall.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.recall.model.RecallRating;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RecallRatingSerializer extends JsonSerializer<RecallRating> {
    @Override
    public void serialize(RecallRating recallRating, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(recallRating.getScore());
    }
}
