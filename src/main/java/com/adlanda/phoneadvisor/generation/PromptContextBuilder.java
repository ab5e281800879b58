package com.adlanda.phoneadvisor.generation;

import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.model.RetrievalResult;

/**
 * Builds the chat prompt for a retrieval result: the question, its intent and criteria,
 * and the attributes of the first few records.
 */
public class PromptContextBuilder {

    private final int maxRecords;

    public PromptContextBuilder(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public String build(RetrievalResult result) {
        StringBuilder phones = new StringBuilder();
        result.records().stream()
                .limit(maxRecords)
                .forEach(record -> appendRecord(phones, record));

        return """
                You are a Samsung phone expert assistant. Based on the following phone data, answer the user's question.

                User Question: %s
                Query Type: %s
                Criteria: %s

                Available Phone Data:
                %s
                Provide a helpful, concise response that:
                1. Directly answers the user's question
                2. Includes relevant specifications
                3. Gives clear recommendations if asked
                4. Highlights key differences in comparisons
                Keep the response under 200 words and focus on the most relevant information."""
                .formatted(result.question(), result.intent().label(), result.criteria(), phones);
    }

    private static void appendRecord(StringBuilder sb, PhoneRecord record) {
        sb.append("Phone: ").append(record.modelName()).append('\n')
                .append("- Release: ").append(record.releaseDate()).append('\n')
                .append("- Display: ").append(record.display()).append('\n')
                .append("- Battery: ").append(record.battery()).append('\n')
                .append("- Camera: ").append(record.camera()).append('\n')
                .append("- RAM: ").append(record.ram()).append('\n')
                .append("- Storage: ").append(record.storage()).append('\n')
                .append("- Chipset: ").append(record.chipset()).append('\n')
                .append("- Price: ").append(record.price()).append("\n\n");
    }
}
