package com.sentiment_retraining.config;

import com.sentiment_retraining.enumeration.BucketTypeEnum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class BucketResolver {

    private final String modelBucket;
    private final String metricsBucket;

    public BucketResolver(@Value("${minio.bucket.models}") String modelBucket,
                          @Value("${minio.bucket.metrics}") String metricsBucket) {
        this.modelBucket = modelBucket;
        this.metricsBucket = metricsBucket;
    }

    public String resolve(BucketTypeEnum type) {
        return switch (type) {
            case MODEL -> modelBucket;
            case METRICS -> metricsBucket;
        };
    }

    public boolean isKnownBucket(String bucketName) {
        return modelBucket.equals(bucketName) || metricsBucket.equals(bucketName);
    }
}
