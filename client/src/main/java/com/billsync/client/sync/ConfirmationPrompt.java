package com.billsync.client.sync;

/**
 * Asks the user a yes/no question. Exactly one of the callbacks runs, once.
 */
public interface ConfirmationPrompt {

    void request(String title, String body, Runnable onConfirm, Runnable onCancel);
}
