package ca.on.oicr.gsi.baker.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Test;

public class BakeryTest {
  private static final String BAKERIES =
      "{\"devseed.bakery.development.aws.us-west-2\": {"
          + "\"region\": \"us-west-2\","
          + "\"targets\": {\"pangeo-forge-aws-bakery-flowcachebucketdasktest4\": {"
          + "  \"region\": \"us-west-2\","
          + "  \"private\": {\"protocol\": \"s3\","
          + "    \"storage_options\": {\"key\": \"S3_KEY\", \"secret\": \"S3_SECRET\"}}}},"
          + "\"cluster\": {"
          + "  \"type\": \"aws.fargate\","
          + "  \"pangeo_forge_version\": \"0.5.0\","
          + "  \"pangeo_notebook_version\": \"2021.07.17\","
          + "  \"prefect_version\": \"0.14.7\","
          + "  \"worker_image\": \"pangeo/pangeo-forge-bakery-images:latest\","
          + "  \"flow_storage\": \"pangeo-forge-aws-bakery-flowstoragebucket\","
          + "  \"flow_storage_protocol\": \"s3\","
          + "  \"flow_storage_options\": {\"key\": \"S3_KEY\", \"secret\": \"S3_SECRET\"},"
          + "  \"max_workers\": 10,"
          + "  \"cluster_options\": {"
          + "    \"vpc\": \"vpc-0\","
          + "    \"cluster_arn\": \"arn:cluster\","
          + "    \"task_role_arn\": \"arn:task\","
          + "    \"execution_role_arn\": \"arn:execution\","
          + "    \"security_groups\": [\"sg-1\", \"sg-2\"],"
          + "    \"unrecognised\": true}}}}";

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  public void bakeryTable_deserializes() throws JsonProcessingException {
    final Map<String, Bakery> bakeries =
        mapper.readValue(BAKERIES, new TypeReference<Map<String, Bakery>>() {});
    final var bakery = bakeries.get("devseed.bakery.development.aws.us-west-2");
    assertEquals("us-west-2", bakery.getRegion());

    final var cluster = bakery.getCluster();
    assertEquals(Optional.of(ClusterType.FARGATE), ClusterType.of(cluster.getType()));
    assertEquals(10, cluster.getMaxWorkers());
    assertEquals("S3_SECRET", cluster.getFlowStorageOptions().getSecret());
    assertEquals(List.of("sg-1", "sg-2"), cluster.getClusterOptions().getSecurityGroups());
    assertEquals(new Versions("2021.07.17", "0.5.0", "0.14.7"), cluster.versions());

    final var target = bakery.getTargets().get("pangeo-forge-aws-bakery-flowcachebucketdasktest4");
    assertEquals("s3", target.getPrivateProtocol().getProtocol());
    assertEquals("S3_KEY", target.getPrivateProtocol().getStorageOptions().getKey());
    assertNull(target.getPublicProtocol());
  }

  @Test
  public void clusterAndProtocolNames_areRecognised() {
    assertEquals(Optional.of(ClusterType.AKS), ClusterType.of("azure.aks"));
    assertEquals(Optional.empty(), ClusterType.of("gcp.gke"));
    assertEquals(Optional.of(StorageProtocol.ABFS), StorageProtocol.of("abfs"));
    assertEquals(Optional.empty(), StorageProtocol.of(null));
  }
}
