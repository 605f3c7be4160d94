package com.umitunal.stepflow.spi;

import java.util.List;

/**
 * Temporary storage for binary attachments referenced by job payloads.
 */
public interface AttachmentStorage {

    void getAttachments(List<String> refs) throws Exception;

    void deleteAttachments(List<String> refs) throws Exception;
}
