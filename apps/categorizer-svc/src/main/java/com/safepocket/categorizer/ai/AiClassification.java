package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.Category;

public record AiClassification(Category category, int confidence) {
}
