package com.sgr.runtime.common.service;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Source of chat model instances, shared across roles and tasks.
 */
public interface ChatModelProvider {

    ChatModel getModel(ModelSpec spec);
}
