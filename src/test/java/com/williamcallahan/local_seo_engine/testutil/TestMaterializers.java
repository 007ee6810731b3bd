package com.williamcallahan.local_seo_engine.testutil;

import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.mapper.BusinessInfoResultMapper;
import com.williamcallahan.local_seo_engine.mapper.BusinessUpdateResultMapper;
import com.williamcallahan.local_seo_engine.mapper.QuestionAnswerResultMapper;
import com.williamcallahan.local_seo_engine.mapper.ReviewResultMapper;
import com.williamcallahan.local_seo_engine.mapper.SocialProfileExtractor;
import com.williamcallahan.local_seo_engine.repository.EnrichmentResultRepository;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.repository.PlaceRepository;
import com.williamcallahan.local_seo_engine.service.enrichment.PlaceReviewStatsService;
import com.williamcallahan.local_seo_engine.service.enrichment.TaskResultMaterializer;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.service.image.PlaceAssetCacheService;
import org.springframework.transaction.support.TransactionOperations;

/** Builds a materializer with real mappers and no surrounding transaction. */
public final class TestMaterializers {

    private TestMaterializers() {}

    public static TaskResultMaterializer create(EnrichmentTaskRepository taskRepository,
                                                EnrichmentResultRepository resultRepository,
                                                PlaceRepository placeRepository,
                                                EnrichmentGateway gateway,
                                                PlaceAssetCacheService assetCacheService,
                                                PlaceReviewStatsService reviewStatsService) {
        return new TaskResultMaterializer(taskRepository, resultRepository, placeRepository, gateway,
            new ReviewResultMapper(),
            new BusinessInfoResultMapper(new EnrichmentProperties()),
            new BusinessUpdateResultMapper(),
            new QuestionAnswerResultMapper(),
            new SocialProfileExtractor(),
            assetCacheService,
            reviewStatsService,
            TransactionOperations.withoutTransaction(),
            new DataForSeoProperties());
    }
}
