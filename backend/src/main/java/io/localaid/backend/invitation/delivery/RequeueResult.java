package io.localaid.backend.invitation.delivery;

public record RequeueResult(int requeued) {}
