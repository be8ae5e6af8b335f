package io.flowdeck.core.task.spi;

import io.flowdeck.core.task.Task;
import java.util.List;
import java.util.Map;

/// Service provider interface for decoding structural task fields that arrive as JSON text.
///
/// Some definition sources hand over `decisionCases`, `defaultCase`, `forkTasks` or
/// `loopOver` as string-encoded JSON instead of nested objects. `flowdeck-core` carries no
/// JSON library, so the projector delegates decoding to an implementation of this interface
/// (the Jackson-backed one lives in `flowdeck-serialization`).
///
/// @implNote Implementations must be stateless or thread-safe.
/// @see io.flowdeck.core.graph.GraphProjector
public interface StructuralFieldParser {

    /// Decodes a task list (`defaultCase`, `loopOver`).
    ///
    /// @param json raw JSON text, not null
    /// @return decoded tasks in document order, never null
    /// @throws EmbeddedJsonException if the text is not a JSON array of task objects
    List<Task> parseTaskList(String json) throws EmbeddedJsonException;

    /// Decodes a decision case map (`decisionCases`).
    ///
    /// @param json raw JSON text, not null
    /// @return case label to task list, in document order, never null
    /// @throws EmbeddedJsonException if the text is not an object of task arrays
    Map<String, List<Task>> parseCaseMap(String json) throws EmbeddedJsonException;

    /// Decodes fork branches (`forkTasks`).
    ///
    /// @param json raw JSON text, not null
    /// @return branches in document order, never null
    /// @throws EmbeddedJsonException if the text is not an array of task arrays
    List<List<Task>> parseBranches(String json) throws EmbeddedJsonException;

    /// Parser for environments without a JSON library: every call fails, so string-encoded
    /// fields are always kept verbatim.
    StructuralFieldParser UNSUPPORTED =
            new StructuralFieldParser() {
                @Override
                public List<Task> parseTaskList(String json) throws EmbeddedJsonException {
                    throw unsupported();
                }

                @Override
                public Map<String, List<Task>> parseCaseMap(String json)
                        throws EmbeddedJsonException {
                    throw unsupported();
                }

                @Override
                public List<List<Task>> parseBranches(String json) throws EmbeddedJsonException {
                    throw unsupported();
                }

                private EmbeddedJsonException unsupported() {
                    return new EmbeddedJsonException("No JSON parser configured");
                }
            };
}
