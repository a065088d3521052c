package com.docrender.core.error;

/**
 * An operation attached to a content item failed. Carries the content identifier, the index and
 * name of the failing operation and the stage (validate or apply) in which it failed.
 */
public class PipelineException extends DocRenderException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the failure occurred. */
    public enum Stage {
        VALIDATE,
        APPLY
    }

    private final String contentId;
    private final int operationIndex;
    private final String operationName;
    private final Stage stage;

    public PipelineException(String contentId, int operationIndex, String operationName, Stage stage, Throwable cause) {
        super(String.format("content '%s': operation %d (%s) failed to %s: %s",
                contentId, operationIndex, operationName, stage.name().toLowerCase(), cause.getMessage()), cause);
        this.contentId = contentId;
        this.operationIndex = operationIndex;
        this.operationName = operationName;
        this.stage = stage;
    }

    public String contentId() {
        return contentId;
    }

    public int operationIndex() {
        return operationIndex;
    }

    public String operationName() {
        return operationName;
    }

    public Stage stage() {
        return stage;
    }
}
