package com.eainde.sos.extraction;

import com.eainde.sos.model.ContactCategory;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.util.Arrays;
import java.util.List;

/**
 * JSON schema the extraction model must answer in. Mirrors {@link ExtractionOutput}.
 */
public final class ContactExtractionSchema {

    public static final String SCHEMA_NAME = "emergency_contacts";

    private ContactExtractionSchema() {}

    public static JsonSchema schema() {
        List<String> categories = Arrays.stream(ContactCategory.values())
                .map(Enum::name)
                .toList();

        JsonObjectSchema contact = JsonObjectSchema.builder()
                .addStringProperty("name", "Official name of the service or organisation")
                .addStringProperty("phoneNumber", "Number to dial, including country code where applicable")
                .addProperty("category", JsonEnumSchema.builder()
                        .enumValues(categories)
                        .description("NATIONAL_EMERGENCY for the national emergency number, otherwise CRISIS_HOTLINE")
                        .build())
                .addStringProperty("sourceUrl", "URL of the page the number was taken from")
                .addStringProperty("description", "One sentence describing the service")
                .required("name", "phoneNumber", "category", "sourceUrl")
                .build();

        JsonObjectSchema root = JsonObjectSchema.builder()
                .addProperty("contacts", JsonArraySchema.builder()
                        .items(contact)
                        .description("Exactly 5 contacts: 1 NATIONAL_EMERGENCY followed by 4 CRISIS_HOTLINE")
                        .build())
                .required("contacts")
                .build();

        return JsonSchema.builder()
                .name(SCHEMA_NAME)
                .rootElement(root)
                .build();
    }

    public static ResponseFormat responseFormat() {
        return ResponseFormat.builder()
                .type(ResponseFormatType.JSON)
                .jsonSchema(schema())
                .build();
    }
}
