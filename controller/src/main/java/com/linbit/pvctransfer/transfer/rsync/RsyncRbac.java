package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.CleanupMarker;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.naming.ResourceNames;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleRefBuilder;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;

/**
 * Service account of the mover pods, bound to a role that may use the security context constraint
 * of the mover
 */
class RsyncRbac
{
    private static final String SCC_API_GROUP = "security.openshift.io";
    private static final String SCC_RESOURCE = "securitycontextconstraints";
    private static final String RBAC_API_GROUP = "rbac.authorization.k8s.io";

    private final ObjectKey serviceAccountKey;
    private final ObjectKey roleKey;
    private final ObjectKey roleBindingKey;

    RsyncRbac(String namespace, String identitySuffix, int nameLimit)
    {
        serviceAccountKey = new ObjectKey(
            namespace,
            ResourceNames.build(ResourceNames.RSYNC_SERVICE_ACCOUNT, identitySuffix, nameLimit)
        );
        roleKey = new ObjectKey(
            namespace,
            ResourceNames.build(ResourceNames.RSYNC_ROLE, identitySuffix, nameLimit)
        );
        roleBindingKey = new ObjectKey(
            namespace,
            ResourceNames.build(ResourceNames.RSYNC_ROLE_BINDING, identitySuffix, nameLimit)
        );
    }

    void reconcile(
        ObjectReconciler reconciler,
        Map<String, String> labels,
        List<OwnerReference> ownerRefs,
        String sccName
    )
        throws PvcTransferException
    {
        reconciler.createOrUpdate(
            ServiceAccount.class,
            serviceAccountKey,
            (sa, exists) -> MetadataUtils.applyMetadata(sa, labels, null, ownerRefs)
        );
        reconciler.createOrUpdate(
            Role.class,
            roleKey,
            (role, exists) ->
            {
                MetadataUtils.applyMetadata(role, labels, null, ownerRefs);
                role.setRules(
                    Collections.singletonList(
                        new PolicyRuleBuilder()
                            .withApiGroups(SCC_API_GROUP)
                            .withResources(SCC_RESOURCE)
                            .withResourceNames(sccName)
                            .withVerbs("use")
                            .build()
                    )
                );
            }
        );
        reconciler.createOrUpdate(
            RoleBinding.class,
            roleBindingKey,
            (binding, exists) ->
            {
                MetadataUtils.applyMetadata(binding, labels, null, ownerRefs);
                binding.setRoleRef(
                    new RoleRefBuilder()
                        .withApiGroup(RBAC_API_GROUP)
                        .withKind("Role")
                        .withName(roleKey.getName())
                        .build()
                );
                binding.setSubjects(
                    Collections.singletonList(
                        new SubjectBuilder()
                            .withKind("ServiceAccount")
                            .withName(serviceAccountKey.getName())
                            .withNamespace(serviceAccountKey.getNamespace())
                            .build()
                    )
                );
            }
        );
    }

    CleanupMarker addTo(CleanupMarker marker)
    {
        return marker
            .add(ServiceAccount.class, serviceAccountKey)
            .add(Role.class, roleKey)
            .add(RoleBinding.class, roleBindingKey);
    }

    String getServiceAccountName()
    {
        return serviceAccountKey.getName();
    }
}
