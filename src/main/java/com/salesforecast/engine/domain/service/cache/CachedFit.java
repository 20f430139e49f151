package com.salesforecast.engine.domain.service.cache;

import com.salesforecast.engine.domain.service.evaluation.AccuracyReport;
import com.salesforecast.engine.domain.service.model.FittedModel;

public record CachedFit(FittedModel model, AccuracyReport accuracy) {
}
