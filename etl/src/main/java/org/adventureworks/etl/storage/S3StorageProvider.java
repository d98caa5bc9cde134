/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.adventureworks.etl.storage;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3Object;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Storage provider implementation for Amazon S3.
 *
 * <p>Paths are {@code s3://bucket/key} URIs.
 */
public class S3StorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageProvider.class);

  private static final String S3_SCHEME = "s3://";

  private final AmazonS3 s3Client;

  public S3StorageProvider() {
    this((AmazonS3) null, null);
  }

  public S3StorageProvider(AmazonS3 s3Client) {
    this(s3Client, null);
  }

  /**
   * Constructor with explicit configuration.
   * Accepts a config map with: region, accessKeyId, secretAccessKey, endpoint
   */
  public S3StorageProvider(Map<String, Object> config) {
    this(null, config);
  }

  private S3StorageProvider(@Nullable AmazonS3 s3Client, @Nullable Map<String, Object> config) {
    this.s3Client = s3Client != null ? s3Client : buildClient(config);
  }

  private static AmazonS3 buildClient(@Nullable Map<String, Object> config) {
    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(5 * 60 * 1000); // 5 minutes
    clientConfig.setConnectionTimeout(60 * 1000);   // 60 seconds

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig);

    String accessKeyId = config != null ? (String) config.get("accessKeyId") : null;
    String secretAccessKey = config != null ? (String) config.get("secretAccessKey") : null;
    if (accessKeyId != null && secretAccessKey != null) {
      builder.withCredentials(
          new AWSStaticCredentialsProvider(
              new BasicAWSCredentials(accessKeyId, secretAccessKey)));
    } else {
      builder.withCredentials(new DefaultAWSCredentialsProviderChain());
    }

    // Priority: config > AWS_ENDPOINT_OVERRIDE environment variable
    String endpoint = config != null ? (String) config.get("endpoint") : null;
    if (endpoint == null) {
      endpoint = System.getenv("AWS_ENDPOINT_OVERRIDE");
    }

    String region = config != null ? (String) config.get("region") : null;
    if (region == null) {
      region = System.getenv("AWS_REGION");
    }
    if (region == null) {
      try {
        region = new DefaultAwsRegionProviderChain().getRegion();
      } catch (SdkClientException e) {
        LOGGER.debug("No AWS region configured, defaulting to us-east-1: {}", e.getMessage());
        region = "us-east-1";
      }
    }

    if (endpoint != null) {
      // S3-compatible services such as MinIO need path-style access
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    return builder.build();
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      S3Object object = s3Client.getObject(new GetObjectRequest(s3Uri.bucket, s3Uri.key));
      LOGGER.debug("Opened S3 object {} ({} bytes)", path,
          object.getObjectMetadata().getContentLength());
      return object.getObjectContent();
    } catch (AmazonServiceException e) {
      throw new IOException("Failed to read file from S3: " + path, e);
    }
  }

  @Override public boolean exists(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      boolean exists = s3Client.doesObjectExist(s3Uri.bucket, s3Uri.key);
      LOGGER.debug("S3 exists check: {} -> {}", path, exists);
      return exists;
    } catch (AmazonServiceException e) {
      throw new IOException("Failed to check existence of S3 object: " + path, e);
    }
  }

  @Override public void writeFile(String path, byte[] content) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);

    ObjectMetadata metadata = new ObjectMetadata();
    metadata.setContentLength(content.length);
    if (path.endsWith(".csv")) {
      metadata.setContentType("text/csv");
    }

    try {
      PutObjectRequest request = new PutObjectRequest(s3Uri.bucket, s3Uri.key,
          new ByteArrayInputStream(content), metadata);
      s3Client.putObject(request);
      LOGGER.debug("Wrote {} bytes to {}", content.length, path);
    } catch (AmazonServiceException e) {
      throw new IOException("Failed to write file to S3: " + path, e);
    }
  }

  @Override public String getStorageType() {
    return "s3";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    if (relativePath.startsWith(S3_SCHEME)) {
      return relativePath;
    }
    String base = basePath.endsWith("/") ? basePath : basePath + "/";
    String relative = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
    return base + relative;
  }

  /**
   * Splits an {@code s3://bucket/key} path at the first slash after the bucket.
   * The key is kept exactly as given, so characters such as {@code #},
   * {@code %} and {@code +} are part of the object name.
   */
  static S3Uri parseS3Uri(String uri) throws IOException {
    if (!uri.regionMatches(true, 0, S3_SCHEME, 0, S3_SCHEME.length())) {
      throw new IOException("Invalid S3 URI: " + uri);
    }
    String rest = uri.substring(S3_SCHEME.length());
    int slash = rest.indexOf('/');
    String bucket = slash < 0 ? rest : rest.substring(0, slash);
    String key = slash < 0 ? "" : rest.substring(slash + 1);
    if (bucket.isEmpty()) {
      throw new IOException("Invalid S3 URI, missing bucket: " + uri);
    }
    return new S3Uri(bucket, key);
  }

  /**
   * Bucket and key of an S3 URI.
   */
  static class S3Uri {
    final String bucket;
    final String key;

    S3Uri(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }
  }
}
