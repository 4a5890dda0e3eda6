package no.cantara.worldview.mcp;

import no.cantara.worldview.TokenTable;
import no.cantara.worldview.WorldviewValidator;

import java.util.List;

/**
 * Applies search/replace edits to a Worldview document and validates the outcome.
 *
 * <p>Nothing here touches the file system: the caller decides whether to persist a
 * {@link Proposal} based on {@link Proposal#accepted()}. Any validation error rejects the
 * edit; warnings never do.
 */
public final class WorldviewEditor {

    private WorldviewEditor() {}

    /** One search/replace operation. An empty {@code newString} deletes the match. */
    public record Edit(String oldString, String newString) {}

    /** Thrown when an edit cannot be applied to the current text. */
    public static class EditException extends IllegalArgumentException {
        public EditException(String msg) { super(msg); }
    }

    /**
     * The edited text together with its validation result.
     */
    public record Proposal(String content, WorldviewValidator.ValidationResult validation) {
        public boolean accepted() { return validation.isValid(); }
    }

    public static Proposal propose(String current, List<Edit> edits, TokenTable tokens) {
        String content = apply(current, edits);
        return new Proposal(content, WorldviewValidator.validate(content, tokens));
    }

    /**
     * Applies the edits in order. Every {@code oldString} must occur exactly once in the text
     * produced by the edits before it. An empty document can only be seeded with an empty
     * {@code oldString}. The result always ends with a newline unless it is empty.
     *
     * @throws EditException if an edit is ambiguous, missing, or malformed
     */
    public static String apply(String current, List<Edit> edits) {
        if (edits.isEmpty()) {
            throw new EditException("Error: 'edits' array cannot be empty");
        }
        String content = current;
        for (int i = 0; i < edits.size(); i++) {
            Edit edit = edits.get(i);
            int n = i + 1;
            if (edit.oldString() == null) {
                throw new EditException("Edit " + n + ": missing 'old_string'");
            }
            if (edit.newString() == null) {
                throw new EditException("Edit " + n + ": missing 'new_string'");
            }

            if (content.isEmpty()) {
                if (!edit.oldString().isEmpty()) {
                    throw new EditException("Edit " + n
                        + ": file is empty, old_string must be empty to create new content");
                }
                content = edit.newString();
                continue;
            }
            if (edit.oldString().isEmpty()) {
                throw new EditException("Edit " + n + ": old_string must not be empty when the file has content");
            }

            int count = occurrences(content, edit.oldString());
            if (count == 0) {
                throw new EditException("Edit " + n + ": old_string not found in file. "
                    + "Make sure the string matches exactly, including whitespace and indentation.");
            }
            if (count > 1) {
                throw new EditException("Edit " + n + ": old_string found " + count + " times (must be unique). "
                    + "Include more surrounding context to make the match unique.");
            }
            int at = content.indexOf(edit.oldString());
            content = content.substring(0, at) + edit.newString() + content.substring(at + edit.oldString().length());
        }

        if (!content.isEmpty() && !content.endsWith("\n")) {
            content = content + "\n";
        }
        return content;
    }

    static int occurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        int at;
        while ((at = text.indexOf(needle, from)) >= 0) {
            count++;
            from = at + needle.length();
        }
        return count;
    }
}
