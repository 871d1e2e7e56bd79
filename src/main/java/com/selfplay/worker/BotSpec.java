package com.selfplay.worker;

import com.selfplay.inference.Evaluator;

public record BotSpec(int botIdx, String botName, Evaluator evaluator) {
}
