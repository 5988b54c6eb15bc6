package com.kubeprov.provisioner.step.aws;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DescribeImagesRequest;
import com.amazonaws.services.ec2.model.Filter;
import com.amazonaws.services.ec2.model.Image;
import com.kubeprov.provisioner.step.AwsSettings;
import com.kubeprov.provisioner.step.ExecutionContext;
import com.kubeprov.provisioner.step.ProvisionConfig;
import com.kubeprov.provisioner.step.StepException;
import com.kubeprov.provisioner.step.StepManifest;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the machine image every node boots from: the configured AMI when one
 * is given (after checking it exists in the region), otherwise the newest
 * Canonical Ubuntu 22.04 image.
 */
@Component
public class FindAmiStep extends AwsStep {

    public static final String NAME = "awsFindAMI";

    static final String CANONICAL_OWNER = "099720109477";
    static final String UBUNTU_IMAGE_PATTERN = "ubuntu/images/hvm-ssd/ubuntu-jammy-22.04-amd64-server-*";

    private static final StepManifest MANIFEST = StepManifest.of(
            NAME, "Find the Ubuntu machine image for cluster nodes");

    public FindAmiStep(AwsClientFactory clients) {
        super(clients);
    }

    @Override public StepManifest manifest() { return MANIFEST; }

    @Override
    protected void doRun(ExecutionContext ctx, PrintWriter out, ProvisionConfig cfg) {
        AwsSettings aws = cfg.requireAws();
        AmazonEC2 ec2 = clients.ec2(cfg);
        try {
            String imageId = isBlank(aws.imageId()) ? latestUbuntu(ec2, cfg) : verify(ec2, aws.imageId());
            cfg.outputs().put(NAME, AwsOutputs.IMAGE_ID, imageId);
            out.printf("  using image %s%n", imageId);
        } finally {
            ec2.shutdown();
        }
    }

    @Override
    protected void doRollback(PrintWriter out, ProvisionConfig cfg) {
        cfg.outputs().remove(NAME, AwsOutputs.IMAGE_ID);
    }

    private String latestUbuntu(AmazonEC2 ec2, ProvisionConfig cfg) {
        List<Image> images = ec2.describeImages(new DescribeImagesRequest()
                .withOwners(CANONICAL_OWNER)
                .withFilters(
                        new Filter("name", List.of(UBUNTU_IMAGE_PATTERN)),
                        new Filter("state", List.of("available"))))
                .getImages();
        // creationDate is ISO-8601, so lexical order is chronological
        return images.stream()
                .filter(i -> i.getCreationDate() != null)
                .max(Comparator.comparing(Image::getCreationDate))
                .map(Image::getImageId)
                .orElseThrow(() -> new StepException(StepException.Kind.EXECUTION, NAME,
                        NAME + ": no Ubuntu image found in region " + cfg.region(), null));
    }

    private String verify(AmazonEC2 ec2, String imageId) {
        List<Image> images = ec2.describeImages(new DescribeImagesRequest().withImageIds(imageId)).getImages();
        if (images.isEmpty()) {
            throw new StepException(StepException.Kind.CONFIGURATION, NAME,
                    NAME + ": image " + imageId + " not found", null);
        }
        return imageId;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
