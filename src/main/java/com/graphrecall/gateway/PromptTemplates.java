package com.graphrecall.gateway;

import java.util.List;

/**
 * Prompts sent to the chat model. {@code <user>} stands for the speaker and is
 * replaced with the username when responses are parsed.
 */
final class PromptTemplates {

    static final String USER_PLACEHOLDER = "<user>";

    static final String EXTRACTION_SYSTEM =
            "You are an expert at parsing text into entity-relationship triples. " +
            "Always return a JSON object with a \"relationships\" array, no other text.";

    static final String QUERY_SYSTEM =
            "You are an expert at parsing queries into entities and relationships. " +
            "Always return valid JSON only, no other text.";

    static final String ENTITY_SYSTEM =
            "You are an expert at creating very concise, factual entity descriptions. " +
            "Keep all descriptions under 80 characters.";

    static final String RELATIONSHIP_SYSTEM =
            "You are an expert at creating concise semantic descriptions of relationships. " +
            "Focus ONLY on the relationship itself, not the entities involved.";

    static final String SUMMARY_SYSTEM =
            "You are a precise summarization assistant. Merge accumulated notes about one entity " +
            "into a single description that keeps every distinct fact and drops repetition.";

    static final String ANSWER_SYSTEM =
            "You answer questions about a person's own notes. Use only the statements provided. " +
            "If they do not contain the answer, say so. Answer in one or two sentences.";

    private static final String EXTRACTION_TEMPLATE = """
            Parse the following input into entity-relationship triples. The user who wrote this input is "%1$s".

            Rules:
            1. Extract ALL distinct entities and their relationships
            2. Use "<user>" to represent the user who wrote the input (%1$s)
            3. Handle possessives properly (e.g., "my girlfriend" becomes "<user>'s girlfriend")
            4. Create one triple for each unique relationship between entities
            5. When the input says two names refer to the same thing ("A is B" where both sides are
               entities, not descriptions), emit one triple with "isAlias": true
            6. Subjective or descriptive claims about anything other than the user are the user's
               claims: make "<user>" the source and start the relationship with "claims"
            7. Return {"relationships": [...]} only

            Examples:
            Input: "Jake Owen is my favorite country artist"
            Output: {"relationships": [{"sourceEntity": "<user>", "relationship": "favorite country artist is", "targetEntity": "Jake Owen", "isAlias": false}]}

            Input: "my girlfriend has a crush on jake owen"
            Output: {"relationships": [{"sourceEntity": "<user>'s girlfriend", "relationship": "has crush on", "targetEntity": "Jake Owen", "isAlias": false}]}

            Input: "the food at Guelaguetza is spicy"
            Output: {"relationships": [{"sourceEntity": "<user>", "relationship": "claims is spicy", "targetEntity": "the food at Guelaguetza", "isAlias": false}]}

            Input: "Marissa is my fiancee"
            Output: {"relationships": [{"sourceEntity": "Marissa", "relationship": "is", "targetEntity": "<user>'s fiancee", "isAlias": true}]}

            Now parse this input: "%2$s"
            """;

    private static final String QUERY_TEMPLATE = """
            Parse this query to extract the main entities and relationship being asked about.

            Rules:
            1. Use "<user>" to represent the user asking (%1$s)
            2. Handle possessives properly (e.g., "my girlfriend" becomes "<user>'s girlfriend")
            3. Questions about what the user thinks of something are about the user's claims:
               the entity is "<user>" and the relationship starts with "claims"
            4. Extract the core relationship being queried
            5. Return {"entities": [...], "relationship": "..."} only

            Examples:
            Query: "who is my favorite country artist"
            Output: {"entities": ["<user>"], "relationship": "favorite country artist is"}

            Query: "Who does my girlfriend love?"
            Output: {"entities": ["<user>'s girlfriend"], "relationship": "loves"}

            Query: "what does Jake Owen do?"
            Output: {"entities": ["Jake Owen"], "relationship": "does"}

            Now parse this query: "%2$s"
            """;

    private static final String ENTITY_TEMPLATE = """
            Generate a very concise description for "%s". Keep under 80 characters total.
            The notes belong to the user "%s"; "%s's" names something of theirs.
            %s
            Rules:
            1. Maximum 1-2 short sentences
            2. Focus on core identity/role
            3. Be factual and brief

            Now generate a description for: "%s"
            """;

    private static final String RELATIONSHIP_TEMPLATE = """
            Generate a semantic description of ONLY the relationship "%1$s".
            Focus purely on what "%1$s" means between any two entities. Do not add external context.

            Rules:
            1. Do not describe the entities
            2. Keep under 80 characters

            Examples:
            Relationship: "loves"
            Output: Strong emotional affection and admiration.

            Relationship: "favorite country artist is"
            Output: Top preference ranking above all others in category.

            Relationship: "%1$s"
            Output:""";

    private static final String SUMMARY_TEMPLATE = """
            Entity: %s

            Accumulated notes:
            %s

            Produce a single description of at most %d characters. Output only the description.
            """;

    private PromptTemplates() {
    }

    static String extraction(String text, String username) {
        return EXTRACTION_TEMPLATE.formatted(username, text);
    }

    static String query(String question, String username) {
        return QUERY_TEMPLATE.formatted(username, question);
    }

    static String entity(String name, String username, String context) {
        String contextLine = context == null || context.isBlank()
                ? ""
                : "It was mentioned in: \"" + context + "\"\n";
        return ENTITY_TEMPLATE.formatted(name, username, username, contextLine, name);
    }

    static String relationship(String label) {
        return RELATIONSHIP_TEMPLATE.formatted(label);
    }

    static String summary(String name, String description, int maxLength) {
        return SUMMARY_TEMPLATE.formatted(name, description, maxLength);
    }

    static String answer(String question, List<String> passages) {
        StringBuilder sb = new StringBuilder("Statements:\n");
        for (int i = 0; i < passages.size(); i++) {
            sb.append(i + 1).append(". ").append(passages.get(i)).append('\n');
        }
        sb.append("\nQuestion: ").append(question);
        return sb.toString();
    }
}
